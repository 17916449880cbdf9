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

package com.hyperdx.anomaly.serialize.state;

import static com.hyperdx.anomaly.CommonUtils.checkArgument;
import static com.hyperdx.anomaly.CommonUtils.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import com.hyperdx.anomaly.config.DetectorType;
import com.hyperdx.anomaly.returntypes.AnomalyResult;
import com.hyperdx.anomaly.returntypes.ChangePointVerdict;
import com.hyperdx.anomaly.returntypes.DetectorVerdict;
import com.hyperdx.anomaly.returntypes.IsolationForestVerdict;
import com.hyperdx.anomaly.returntypes.ZScoreVerdict;

/**
 * Maps results and the verdicts in their details. The details of the state
 * use the keys {@code zscore}, {@code changepoint} and {@code isolation}.
 */
public class AnomalyResultMapper implements IStateMapper<AnomalyResult, AnomalyResultState> {

    @Override
    public AnomalyResultState toState(AnomalyResult model) {
        AnomalyResultState state = new AnomalyResultState();
        state.setAnomalous(model.isAnomalous());
        state.setCount(model.getCount());
        state.setTsBucket(model.getTimeBucket().orElse(null));

        DetailsState details = new DetailsState();
        model.getVerdict(DetectorType.ZSCORE, ZScoreVerdict.class).ifPresent(v -> details.setZscore(toState(v)));
        model.getVerdict(DetectorType.CHANGE_POINT, ChangePointVerdict.class)
                .ifPresent(v -> details.setChangePoint(toState(v)));
        model.getVerdict(DetectorType.ISOLATION_FOREST, IsolationForestVerdict.class)
                .ifPresent(v -> details.setIsolationForest(toState(v)));
        state.setDetails(details);
        return state;
    }

    @Override
    public AnomalyResult toModel(AnomalyResultState state) {
        checkNotNull(state, "state must not be null");
        checkArgument(state.getCount() != null, "count is required");
        Map<DetectorType, DetectorVerdict> details = new EnumMap<>(DetectorType.class);
        DetailsState detailsState = state.getDetails();
        if (detailsState != null) {
            if (detailsState.getZscore() != null) {
                ZScoreVerdictState z = detailsState.getZscore();
                details.put(DetectorType.ZSCORE,
                        new ZScoreVerdict(z.isAnomalous(), z.getZscore(), z.getMean(), z.getStdv(), z.getThreshold()));
            }
            if (detailsState.getChangePoint() != null) {
                ChangePointVerdictState c = detailsState.getChangePoint();
                details.put(DetectorType.CHANGE_POINT, new ChangePointVerdict(c.isAnomalous(),
                        (c.getChangePoints() == null) ? Collections.emptyList()
                                : Collections.unmodifiableList(new ArrayList<>(c.getChangePoints())),
                        c.getPenalty()));
            }
            if (detailsState.getIsolationForest() != null) {
                IsolationForestVerdictState i = detailsState.getIsolationForest();
                details.put(DetectorType.ISOLATION_FOREST,
                        new IsolationForestVerdict(i.isAnomalous(), i.getIsolationScore(), i.getContamination()));
            }
        }
        return new AnomalyResult(state.isAnomalous(), state.getCount(), state.getTsBucket(), details);
    }

    ZScoreVerdictState toState(ZScoreVerdict verdict) {
        ZScoreVerdictState state = new ZScoreVerdictState();
        state.setAnomalous(verdict.isAnomalous());
        state.setZscore(verdict.getZscore());
        state.setMean(verdict.getMean());
        state.setThreshold(verdict.getThreshold());
        state.setStdv(verdict.getStdv());
        return state;
    }

    ChangePointVerdictState toState(ChangePointVerdict verdict) {
        ChangePointVerdictState state = new ChangePointVerdictState();
        state.setAnomalous(verdict.isAnomalous());
        state.setPenalty(verdict.getPenalty());
        state.setChangePoints(new ArrayList<>(verdict.getChangePoints()));
        return state;
    }

    IsolationForestVerdictState toState(IsolationForestVerdict verdict) {
        IsolationForestVerdictState state = new IsolationForestVerdictState();
        state.setAnomalous(verdict.isAnomalous());
        state.setIsolationScore(verdict.getIsolationScore());
        state.setContamination(verdict.getContamination());
        return state;
    }
}
