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

package com.amazon.omniad.algorithms.state;

import static com.amazon.omniad.CommonUtils.checkArgument;
import static com.amazon.omniad.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.List;

import com.amazon.omniad.algorithms.isolationforest.IsolationForestModel;
import com.amazon.omniad.algorithms.tree.IsolationTree;
import com.amazon.omniad.state.IStateMapper;
import com.amazon.omniad.state.Version;

public class IsolationForestMapper implements IStateMapper<IsolationForestModel, IsolationForestState> {

    @Override
    public IsolationForestState toState(IsolationForestModel model) {
        IsolationForestState state = new IsolationForestState();
        state.setVersion(Version.V1_0);
        state.setDimensions(model.getDimensions());
        state.setSampleSize(model.getSampleSize());
        List<IsolationTreeState> treeStates = new ArrayList<>(model.getTrees().size());
        for (IsolationTree tree : model.getTrees()) {
            IsolationTreeState treeState = new IsolationTreeState();
            treeState.setSplitFeature(tree.getSplitFeature());
            treeState.setSplitValue(tree.getSplitValue());
            treeState.setLeftChild(tree.getLeftChild());
            treeState.setRightChild(tree.getRightChild());
            treeState.setMass(tree.getMass());
            treeStates.add(treeState);
        }
        state.setTreeStates(treeStates);
        return state;
    }

    @Override
    public IsolationForestModel toModel(IsolationForestState state) {
        checkNotNull(state, "state must not be null");
        checkArgument(Version.V1_0.equals(state.getVersion()),
                "unsupported isolation forest state version " + state.getVersion());
        checkArgument(state.getTreeStates() != null && !state.getTreeStates().isEmpty(), "state holds no trees");
        List<IsolationTree> trees = new ArrayList<>(state.getTreeStates().size());
        for (IsolationTreeState treeState : state.getTreeStates()) {
            trees.add(new IsolationTree(treeState.getSplitFeature(), treeState.getSplitValue(),
                    treeState.getLeftChild(), treeState.getRightChild(), treeState.getMass()));
        }
        return new IsolationForestModel(state.getDimensions(), state.getSampleSize(), trees);
    }
}
