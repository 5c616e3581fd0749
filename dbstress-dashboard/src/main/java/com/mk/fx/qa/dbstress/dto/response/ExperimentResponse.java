package com.mk.fx.qa.dbstress.dto.response;

import com.mk.fx.qa.dbstress.experiment.ExperimentResult;
import com.mk.fx.qa.dbstress.experiment.ExperimentStatus;

/** Current run status plus the latest finished result, which may be null. */
public record ExperimentResponse(ExperimentStatus status, ExperimentResult result) {}
