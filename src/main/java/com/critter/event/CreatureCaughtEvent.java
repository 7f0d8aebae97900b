package com.critter.event;

import com.critter.dto.CreatureDTO;

public record CreatureCaughtEvent(Long chatId, String spawnId, Long trainerId, CreatureDTO creature) {}
