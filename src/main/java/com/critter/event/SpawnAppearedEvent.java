package com.critter.event;

import com.critter.dto.SpawnDTO;

public record SpawnAppearedEvent(SpawnDTO spawn) {}
