package com.critter.event;

import com.critter.dto.BattleStateDTO;

public record BattleCompletedEvent(BattleStateDTO battle) {}
