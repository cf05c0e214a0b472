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

package com.amazon.omniad.archive;

import static com.amazon.omniad.CommonUtils.checkArgument;
import static com.amazon.omniad.CommonUtils.checkNotNull;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.CRC32;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;
import java.util.zip.ZipOutputStream;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.amazon.omniad.Attributes;
import com.amazon.omniad.Detector;
import com.amazon.omniad.DetectorSnapshot;
import com.amazon.omniad.Hyperparameters;
import com.amazon.omniad.common.exception.BackendException;
import com.amazon.omniad.common.exception.ConfigException;
import com.amazon.omniad.common.exception.CorruptArchiveException;
import com.amazon.omniad.common.exception.UnknownAlgorithmException;
import com.amazon.omniad.common.exception.UnsupportedVersionException;
import com.amazon.omniad.registry.DetectorRegistry;
import com.amazon.omniad.state.DetectorMetadata;
import com.amazon.omniad.state.Version;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads and writes detector archives. An archive is a ZIP container holding
 * exactly three entries, named by {@link ArchiveSegment}: a JSON metadata
 * record, the JSON encoded attributes, and the backend's opaque model bytes.
 *
 * <p>
 * {@link #save} writes to a temporary file next to the destination and moves
 * it into place, so the destination either keeps its old content or holds a
 * complete archive. {@link #load} checks the format version before it touches
 * the registry or any backend.
 */
@Getter
@Setter
public class ArchiveCodec {

    private static final Logger LOG = LogManager.getLogger(ArchiveCodec.class);

    public static final String ARCHIVE_EXTENSION = ".zip";

    public static final long DEFAULT_MAX_SEGMENT_BYTES = 1L << 30;

    private static final String FORMAT_VERSION_FIELD = "format_version";

    // fields without a usable default; a record lacking one is corrupt
    private static final List<String> REQUIRED_NUMBER_FIELDS = Arrays.asList("threshold", "contamination");

    private static final List<String> REQUIRED_STRING_FIELDS = Arrays.asList("algorithm_id", "class_name");

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private final ObjectMapper objectMapper;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private final AttributesCodec attributesCodec;

    /**
     * Whether entries are deflated. Stored entries are larger but cheaper to
     * write for models that are already dense binary.
     */
    private boolean compressionEnabled = true;

    /**
     * Upper bound on the decoded size of a single segment, checked on load.
     */
    private long maxSegmentBytes = DEFAULT_MAX_SEGMENT_BYTES;

    public ArchiveCodec() {
        this(new ObjectMapper());
    }

    public ArchiveCodec(ObjectMapper objectMapper) {
        this.objectMapper = checkNotNull(objectMapper, "objectMapper must not be null");
        this.attributesCodec = new AttributesCodec(objectMapper);
    }

    /**
     * Writes a fitted detector to {@code destination}, replacing any existing
     * file. The detector is serialized completely before the file system is
     * touched.
     *
     * @param detector    a fitted detector
     * @param destination where to write the archive
     * @throws IOException if the archive cannot be written; the destination is
     *                     then unchanged
     * @throws com.amazon.omniad.common.exception.NotFittedException if the
     *                     detector is not fitted
     */
    public void save(Detector<?> detector, Path destination) throws IOException {
        checkNotNull(detector, "detector must not be null");
        checkNotNull(destination, "destination must not be null");

        DetectorSnapshot snapshot = detector.snapshot();
        byte[] metadata = objectMapper.writeValueAsBytes(toMetadata(snapshot));
        byte[] attributes = attributesCodec.toBytes(snapshot.getAttributes());
        byte[] backend = snapshot.getBackendArtifact();

        Path target = destination.toAbsolutePath();
        Path temporary = Files.createTempFile(target.getParent(), "." + target.getFileName(), ".tmp");
        try {
            try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(temporary));
                    ZipOutputStream zip = new ZipOutputStream(out)) {
                writeEntry(zip, ArchiveSegment.METADATA, metadata);
                writeEntry(zip, ArchiveSegment.ATTRIBUTES, attributes);
                writeEntry(zip, ArchiveSegment.BACKEND, backend);
            }
            publish(temporary, target);
        } catch (IOException | RuntimeException e) {
            try {
                Files.deleteIfExists(temporary);
            } catch (IOException suppressed) {
                e.addSuppressed(suppressed);
            }
            throw e;
        }
        LOG.info("saved {} detector to {} ({} backend bytes)", snapshot.getAlgorithmId(), target, backend.length);
    }

    /**
     * Reads an archive and rebuilds the detector through {@code registry}. If
     * {@code source} does not exist and has no {@value #ARCHIVE_EXTENSION}
     * suffix, the suffixed path is tried as well.
     *
     * @param source   the archive path
     * @param registry registry that resolves the stored algorithm id
     * @return a fitted detector equivalent to the one that was saved
     * @throws NoSuchFileException          if neither path exists
     * @throws UnsupportedVersionException  if the archive was written with a
     *                                      different format version
     * @throws CorruptArchiveException      if a segment is missing or malformed
     * @throws UnknownAlgorithmException    if the registry does not know the
     *                                      algorithm
     * @throws IOException                  if the file cannot be read
     */
    public Detector<?> load(Path source, DetectorRegistry registry) throws IOException {
        checkNotNull(registry, "registry must not be null");
        Path path = resolveSource(source);
        try (ZipFile zip = open(path)) {
            DetectorMetadata metadata = readMetadata(zip);
            Attributes attributes = readAttributes(zip);
            byte[] backend = readSegment(zip, ArchiveSegment.BACKEND);
            checkAttributes(attributes);

            Detector<?> detector = resolve(registry, metadata);
            String className = detector.getBackend().getClass().getName();
            if (!className.equals(metadata.getClassName())) {
                LOG.warn("archive {} was written by {} but {} resolves to {}", path, metadata.getClassName(),
                        metadata.getAlgorithmId(), className);
            }
            try {
                detector.restore(metadata.getThreshold(), attributes, backend);
            } catch (BackendException e) {
                throw new CorruptArchiveException(ArchiveSegment.BACKEND, e.getMessage(), e);
            }
            LOG.info("loaded {} detector from {}", metadata.getAlgorithmId(), path);
            return detector;
        }
    }

    /**
     * Reads only the metadata segment. No registry or backend is involved.
     *
     * @param source the archive path
     * @return the metadata record
     * @throws IOException if the file cannot be read
     */
    public DetectorMetadata readMetadata(Path source) throws IOException {
        try (ZipFile zip = open(resolveSource(source))) {
            return readMetadata(zip);
        }
    }

    /**
     * Reads only the attributes segment, after checking the format version.
     *
     * @param source the archive path
     * @return the stored attributes
     * @throws IOException if the file cannot be read
     */
    public Attributes readAttributes(Path source) throws IOException {
        try (ZipFile zip = open(resolveSource(source))) {
            readMetadata(zip);
            return readAttributes(zip);
        }
    }

    private DetectorMetadata toMetadata(DetectorSnapshot snapshot) {
        DetectorMetadata metadata = new DetectorMetadata();
        metadata.setAlgorithmId(snapshot.getAlgorithmId());
        metadata.setThreshold(snapshot.getThreshold());
        metadata.setClassName(snapshot.getClassName());
        metadata.setContamination(snapshot.getContamination());
        metadata.setHyperparameters(new LinkedHashMap<>(snapshot.getHyperparameters().asMap()));
        return metadata;
    }

    private void writeEntry(ZipOutputStream zip, ArchiveSegment segment, byte[] bytes) throws IOException {
        ZipEntry entry = new ZipEntry(segment.getEntryName());
        if (!compressionEnabled) {
            CRC32 crc = new CRC32();
            crc.update(bytes);
            entry.setMethod(ZipEntry.STORED);
            entry.setSize(bytes.length);
            entry.setCompressedSize(bytes.length);
            entry.setCrc(crc.getValue());
        }
        zip.putNextEntry(entry);
        zip.write(bytes);
        zip.closeEntry();
    }

    private static void publish(Path temporary, Path target) throws IOException {
        try {
            Files.move(temporary, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.debug("atomic move not supported for {}, replacing in place", target);
            Files.move(temporary, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static Path resolveSource(Path source) throws NoSuchFileException {
        checkNotNull(source, "source must not be null");
        if (Files.exists(source)) {
            return source;
        }
        String name = source.getFileName() == null ? "" : source.getFileName().toString();
        if (!name.endsWith(ARCHIVE_EXTENSION)) {
            Path suffixed = source.resolveSibling(name + ARCHIVE_EXTENSION);
            if (Files.exists(suffixed)) {
                return suffixed;
            }
        }
        throw new NoSuchFileException(source.toString());
    }

    private static ZipFile open(Path path) throws IOException {
        try {
            return new ZipFile(path.toFile());
        } catch (ZipException e) {
            throw new CorruptArchiveException(path + " is not a detector archive", e);
        }
    }

    private DetectorMetadata readMetadata(ZipFile zip) throws IOException {
        byte[] bytes = readSegment(zip, ArchiveSegment.METADATA);
        JsonNode root;
        try {
            root = objectMapper.readTree(bytes);
        } catch (JsonProcessingException e) {
            throw new CorruptArchiveException(ArchiveSegment.METADATA, "not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new CorruptArchiveException(ArchiveSegment.METADATA, "expected a JSON object");
        }
        JsonNode version = root.get(FORMAT_VERSION_FIELD);
        if (version == null || !version.isIntegralNumber() || !version.canConvertToInt()) {
            throw new CorruptArchiveException(ArchiveSegment.METADATA, FORMAT_VERSION_FIELD + " is missing");
        }
        if (version.intValue() != Version.FORMAT_VERSION) {
            throw new UnsupportedVersionException(version.intValue(), Version.FORMAT_VERSION);
        }

        for (String field : REQUIRED_NUMBER_FIELDS) {
            JsonNode node = root.get(field);
            if (node == null || !node.isNumber()) {
                throw new CorruptArchiveException(ArchiveSegment.METADATA, field + " is missing or not a number");
            }
        }
        for (String field : REQUIRED_STRING_FIELDS) {
            JsonNode node = root.get(field);
            if (node == null || !node.isTextual()) {
                throw new CorruptArchiveException(ArchiveSegment.METADATA, field + " is missing or not a string");
            }
        }

        DetectorMetadata metadata;
        try {
            metadata = objectMapper.treeToValue(root, DetectorMetadata.class);
        } catch (JsonProcessingException e) {
            throw new CorruptArchiveException(ArchiveSegment.METADATA, e.getOriginalMessage(), e);
        }
        if (metadata.getAlgorithmId() == null || metadata.getAlgorithmId().isEmpty()) {
            throw new CorruptArchiveException(ArchiveSegment.METADATA, "algorithm_id is missing");
        }
        if (!Double.isFinite(metadata.getThreshold())) {
            throw new CorruptArchiveException(ArchiveSegment.METADATA, "threshold is not finite");
        }
        if (!(metadata.getContamination() > 0 && metadata.getContamination() < 1)) {
            throw new CorruptArchiveException(ArchiveSegment.METADATA,
                    "contamination out of range: " + metadata.getContamination());
        }
        if (metadata.getHyperparameters() == null) {
            metadata.setHyperparameters(new LinkedHashMap<>());
        }
        return metadata;
    }

    private Attributes readAttributes(ZipFile zip) throws IOException {
        byte[] bytes = readSegment(zip, ArchiveSegment.ATTRIBUTES);
        try {
            return attributesCodec.fromBytes(bytes);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new CorruptArchiveException(ArchiveSegment.ATTRIBUTES, e.getMessage(), e);
        }
    }

    private byte[] readSegment(ZipFile zip, ArchiveSegment segment) throws IOException {
        ZipEntry entry = zip.getEntry(segment.getEntryName());
        if (entry == null) {
            throw new CorruptArchiveException(segment, "entry is missing");
        }
        int limit = (int) Math.min(maxSegmentBytes, Integer.MAX_VALUE - 8L);
        try (InputStream in = zip.getInputStream(entry)) {
            byte[] bytes = in.readNBytes(limit + 1);
            if (bytes.length > limit) {
                throw new CorruptArchiveException(segment, "larger than " + limit + " bytes");
            }
            return bytes;
        } catch (ZipException e) {
            throw new CorruptArchiveException(segment, "entry is unreadable", e);
        }
    }

    private static void checkAttributes(Attributes attributes) {
        if (!attributes.contains(Attributes.DIMENSIONS)) {
            throw new CorruptArchiveException(ArchiveSegment.ATTRIBUTES, Attributes.DIMENSIONS + " is missing");
        }
        try {
            checkArgument(attributes.getInt(Attributes.DIMENSIONS) > 0, Attributes.DIMENSIONS + " must be positive");
        } catch (RuntimeException e) {
            throw new CorruptArchiveException(ArchiveSegment.ATTRIBUTES, e.getMessage(), e);
        }
    }

    /**
     * Builds the detector shell. A factory that rejects the stored
     * hyperparameters means the metadata no longer describes a valid detector.
     */
    private static Detector<?> resolve(DetectorRegistry registry, DetectorMetadata metadata) {
        Hyperparameters hyperparameters = toHyperparameters(metadata);
        try {
            return registry.resolve(metadata.getAlgorithmId(), hyperparameters);
        } catch (UnknownAlgorithmException e) {
            throw e;
        } catch (ConfigException e) {
            throw new CorruptArchiveException(ArchiveSegment.METADATA,
                    "stored hyperparameters were rejected: " + e.getMessage(), e);
        }
    }

    private static Hyperparameters toHyperparameters(DetectorMetadata metadata) {
        Map<String, Object> values = metadata.getHyperparameters();
        try {
            return Hyperparameters.of(values).with(Detector.CONTAMINATION, metadata.getContamination());
        } catch (ConfigException e) {
            throw new CorruptArchiveException(ArchiveSegment.METADATA, e.getMessage(), e);
        }
    }
}
