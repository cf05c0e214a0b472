/*
 * Copyright 2020 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */

package com.amazon.omniad;

import static com.amazon.omniad.CommonUtils.checkArgument;
import static com.amazon.omniad.CommonUtils.checkNotNull;
import static com.amazon.omniad.CommonUtils.checkState;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.Supplier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.omniad.archive.ArchiveCodec;
import com.amazon.omniad.common.exception.BackendException;
import com.amazon.omniad.common.exception.ConfigException;
import com.amazon.omniad.common.exception.FitCancelledException;
import com.amazon.omniad.common.exception.NotFittedException;
import com.amazon.omniad.common.exception.OmniadException;
import com.amazon.omniad.registry.DetectorRegistry;
import com.amazon.omniad.threshold.QuantileThresholder;
import com.amazon.omniad.validation.InputValidator;

/**
 * A detector is the lifecycle around a backend. It starts unfitted, and a call
 * to {@link #fit} moves it to the fitted state by running a fixed sequence:
 * validate the input, let the backend build a model, score the training data
 * with that model, and set the threshold to the {@code (1 - contamination)}
 * quantile of those scores. The results are assembled off to the side and
 * published with a single write, so a failing fit leaves the detector exactly
 * as it was, and a reader never sees a model without its threshold.
 *
 * <p>
 * Scoring methods only read the fitted state and may be called concurrently.
 * {@link #fit} and {@link #save} must not run concurrently with any other call
 * on the same instance; callers serialize access to a single detector.
 *
 * @param <M> the type of the model produced by the backend
 */
public class Detector<M> implements IDetector {

    private static final Logger LOG = LogManager.getLogger(Detector.class);

    /**
     * Name of the hyperparameter holding the expected outlier fraction.
     */
    public static final String CONTAMINATION = "contamination";

    /**
     * Name of the hyperparameter holding the random seed, for backends that use
     * one.
     */
    public static final String RANDOM_SEED = "randomSeed";

    /**
     * Default expected fraction of outliers.
     */
    public static final double DEFAULT_CONTAMINATION = 0.1;

    private final String algorithmId;
    private final double contamination;
    private final Hyperparameters hyperparameters;
    private final IBackend<M> backend;
    private final QuantileThresholder thresholder;

    /**
     * Null while unfitted. Model, attributes and threshold are always replaced
     * together.
     */
    private volatile FittedState<M> fittedState;

    public Detector(String algorithmId, IBackend<M> backend) {
        this(algorithmId, backend, Hyperparameters.EMPTY);
    }

    /**
     * @param algorithmId     registry id of the algorithm
     * @param backend         the backend that builds and scores models
     * @param hyperparameters construction parameters, including
     *                        {@value #CONTAMINATION}
     * @throws ConfigException if the contamination is not in (0, 1)
     */
    public Detector(String algorithmId, IBackend<M> backend, Hyperparameters hyperparameters) {
        this.algorithmId = checkNotNull(algorithmId, "algorithmId must not be null");
        this.backend = checkNotNull(backend, "backend must not be null");
        this.hyperparameters = checkNotNull(hyperparameters, "hyperparameters must not be null");
        this.contamination = hyperparameters.getDouble(CONTAMINATION, DEFAULT_CONTAMINATION);
        if (!(contamination > 0 && contamination < 1)) {
            throw new ConfigException(algorithmId, "contamination must be in (0, 1), got " + contamination);
        }
        this.thresholder = new QuantileThresholder(contamination);
    }

    @Override
    public String getAlgorithmId() {
        return algorithmId;
    }

    @Override
    public double getContamination() {
        return contamination;
    }

    public Hyperparameters getHyperparameters() {
        return hyperparameters;
    }

    public IBackend<M> getBackend() {
        return backend;
    }

    @Override
    public boolean isFitted() {
        return fittedState != null;
    }

    @Override
    public OptionalDouble getThreshold() {
        FittedState<M> state = fittedState;
        return state == null ? OptionalDouble.empty() : OptionalDouble.of(state.getThreshold());
    }

    /**
     * @return the attributes recorded by the last fit
     * @throws NotFittedException if the detector is not fitted
     */
    public Attributes getAttributes() {
        return requireFitted("getAttributes").getAttributes();
    }

    /**
     * Fits the detector. Calling fit on a fitted detector replaces the model,
     * the attributes and the threshold; nothing from the previous fit is
     * reused.
     *
     * @param input training data
     * @return this detector
     * @throws com.amazon.omniad.common.exception.ValidationException if the input
     *                                                                is malformed
     * @throws BackendException if the backend fails
     */
    @Override
    public Detector<M> fit(FeatureMatrix input) {
        long start = System.nanoTime();
        double[][] data = InputValidator.validate(input);

        Attributes.Builder builder = Attributes.builder().put(Attributes.DIMENSIONS, data[0].length)
                .put(Attributes.TRAINING_ROWS, data.length);
        input.getFeatureNames().ifPresent(names -> builder.put(Attributes.FEATURE_NAMES, names.toArray(new String[0])));

        M model = invoke(LifecyclePhase.BACKEND_FIT, () -> backend.fit(data, builder));
        if (model == null) {
            throw new BackendException(algorithmId, LifecyclePhase.BACKEND_FIT, "backend returned no model");
        }
        Attributes attributes = builder.build();
        if (attributes.getType(Attributes.DIMENSIONS) != AttributeType.INT
                || attributes.getInt(Attributes.DIMENSIONS) != data[0].length) {
            throw new BackendException(algorithmId, LifecyclePhase.BACKEND_FIT,
                    "backend overwrote the " + Attributes.DIMENSIONS + " attribute");
        }

        double[] scores = score(LifecyclePhase.IN_SAMPLE_SCORE, model, attributes, data);
        double threshold = thresholder.getThreshold(scores);

        fittedState = new FittedState<>(model, attributes, threshold);

        if (LOG.isDebugEnabled()) {
            LOG.debug("fitted {} on {} rows x {} columns in {} ms, threshold {}", algorithmId, data.length,
                    data[0].length, (System.nanoTime() - start) / 1_000_000, threshold);
        }
        return this;
    }

    @Override
    public Detector<M> fit(double[][] input) {
        return fit(FeatureMatrix.of(input));
    }

    @Override
    public double[] predictScore(FeatureMatrix input) {
        return predictScore(requireFitted("predictScore"), input);
    }

    @Override
    public int[] predict(FeatureMatrix input) {
        FittedState<M> state = requireFitted("predict");
        return label(predictScore(state, input), state.getThreshold());
    }

    @Override
    public int[] predict(FeatureMatrix input, double threshold) {
        checkArgument(!Double.isNaN(threshold), "threshold must not be NaN");
        return label(predictScore(requireFitted("predict"), input), threshold);
    }

    /**
     * Looks up an optional capability of the fitted model, such as
     * {@link com.amazon.omniad.capability.IFeatureImportance}.
     *
     * @param type the capability interface
     * @param <T>  the capability type
     * @return the capability, or empty if this detector's backend lacks it
     * @throws NotFittedException if the detector is not fitted
     */
    public <T> Optional<T> getCapability(Class<T> type) {
        checkNotNull(type, "type must not be null");
        FittedState<M> state = requireFitted("getCapability");
        Optional<T> capability = invoke(LifecyclePhase.SCORE,
                () -> backend.getCapability(type, state.getModel(), state.getAttributes()));
        return capability == null ? Optional.empty() : capability;
    }

    public boolean hasCapability(Class<?> type) {
        return getCapability(type).isPresent();
    }

    /**
     * Captures the fitted state, including the backend's serialized model, for
     * persistence.
     *
     * @return a snapshot of the fitted detector
     * @throws NotFittedException if the detector is not fitted
     * @throws BackendException   if the backend cannot serialize its model
     */
    public DetectorSnapshot snapshot() {
        FittedState<M> state = requireFitted("save");
        byte[] artifact = invoke(LifecyclePhase.SERIALIZE, () -> backend.serialize(state.getModel()));
        if (artifact == null) {
            throw new BackendException(algorithmId, LifecyclePhase.SERIALIZE, "backend returned no bytes");
        }
        return new DetectorSnapshot(algorithmId, backend.getClass().getName(), contamination, hyperparameters,
                state.getThreshold(), state.getAttributes(), artifact);
    }

    /**
     * Moves an unfitted detector straight to the fitted state from persisted
     * parts. Used when loading an archive.
     *
     * @param threshold       the persisted threshold
     * @param attributes      the persisted attributes
     * @param backendArtifact the backend's serialized model
     * @return this detector
     * @throws IllegalStateException if the detector is already fitted
     * @throws BackendException      if the backend cannot decode the model
     */
    public Detector<M> restore(double threshold, Attributes attributes, byte[] backendArtifact) {
        checkState(fittedState == null, "only an unfitted detector can be restored");
        checkArgument(Double.isFinite(threshold), "threshold must be finite");
        checkNotNull(attributes, "attributes must not be null");
        checkArgument(attributes.contains(Attributes.DIMENSIONS), "attributes must record the dimensions");
        checkNotNull(backendArtifact, "backendArtifact must not be null");

        M model = invoke(LifecyclePhase.DESERIALIZE, () -> backend.deserialize(backendArtifact));
        if (model == null) {
            throw new BackendException(algorithmId, LifecyclePhase.DESERIALIZE, "backend returned no model");
        }
        fittedState = new FittedState<>(model, attributes, threshold);
        return this;
    }

    @Override
    public void save(Path destination) throws IOException {
        new ArchiveCodec().save(this, destination);
    }

    /**
     * Reads a detector archive.
     *
     * @param source   the archive path
     * @param registry registry used to build the detector named in the archive
     * @return a fitted detector
     * @throws IOException if the file cannot be read
     */
    public static Detector<?> load(Path source, DetectorRegistry registry) throws IOException {
        return new ArchiveCodec().load(source, registry);
    }

    private FittedState<M> requireFitted(String operation) {
        FittedState<M> state = fittedState;
        if (state == null) {
            throw new NotFittedException(algorithmId, operation);
        }
        return state;
    }

    private double[] predictScore(FittedState<M> state, FeatureMatrix input) {
        double[][] data = InputValidator.validateForScoring(algorithmId, input, state.getAttributes());
        return score(LifecyclePhase.SCORE, state.getModel(), state.getAttributes(), data);
    }

    private double[] score(LifecyclePhase phase, M model, Attributes attributes, double[][] data) {
        double[] scores = invoke(phase, () -> backend.score(model, attributes, data));
        if (scores == null || scores.length != data.length) {
            throw new BackendException(algorithmId, phase, String.format("expected %d scores, got %s", data.length,
                    scores == null ? "none" : String.valueOf(scores.length)));
        }
        if (!CommonUtils.allFinite(scores)) {
            throw new BackendException(algorithmId, phase, "backend produced NaN or infinite scores");
        }
        return scores;
    }

    private static int[] label(double[] scores, double threshold) {
        int[] labels = new int[scores.length];
        for (int i = 0; i < scores.length; i++) {
            labels[i] = scores[i] >= threshold ? 1 : 0;
        }
        return labels;
    }

    /**
     * Runs a backend call. Library exceptions pass through untouched, except that
     * a cancellation gets the algorithm id attached; any other runtime failure
     * is wrapped with the algorithm id and the phase.
     */
    private <T> T invoke(LifecyclePhase phase, Supplier<T> call) {
        try {
            return call.get();
        } catch (FitCancelledException e) {
            throw e.getAlgorithmId() == null ? new FitCancelledException(algorithmId, e) : e;
        } catch (OmniadException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new BackendException(algorithmId, phase, e);
        }
    }

    @Override
    public String toString() {
        return String.format("Detector{algorithmId=%s, contamination=%s, fitted=%s}", algorithmId, contamination,
                isFitted());
    }
}
