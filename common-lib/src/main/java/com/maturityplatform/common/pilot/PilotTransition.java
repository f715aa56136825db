package com.maturityplatform.common.pilot;

import com.maturityplatform.common.model.PilotStatus;

/** A status change the state machine has accepted. */
public record PilotTransition(PilotStatus from, PilotStatus to) {}
