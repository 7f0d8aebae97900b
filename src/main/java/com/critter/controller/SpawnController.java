package com.critter.controller;

import com.critter.dto.ClaimRequest;
import com.critter.dto.ClaimResult;
import com.critter.dto.SpawnDTO;
import com.critter.dto.SpawnResult;
import com.critter.service.SpawnService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API controller for chat spawns and claims.
 */
@RestController
@RequestMapping("/api/spawns")
@RequiredArgsConstructor
@Slf4j
@CrossOrigin(origins = "*")
public class SpawnController {

    private final SpawnService spawnService;

    /**
     * A chat message was observed; may roll a spawn.
     */
    @PostMapping("/chats/{chatId}/messages")
    public ResponseEntity<SpawnResult> onChatMessage(@PathVariable Long chatId) {
        return ResponseEntity.ok(spawnService.onChatMessage(chatId));
    }

    /**
     * Force a spawn in a chat, subject to the chat cooldown.
     */
    @PostMapping("/chats/{chatId}")
    public ResponseEntity<SpawnResult> triggerSpawn(@PathVariable Long chatId) {
        log.info("Spawn requested in chat {}", chatId);
        return ResponseEntity.ok(spawnService.triggerSpawn(chatId));
    }

    @GetMapping("/chats/{chatId}/active")
    public ResponseEntity<SpawnDTO> getActiveSpawn(@PathVariable Long chatId) {
        return spawnService.getActiveSpawn(chatId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/{spawnId}")
    public ResponseEntity<SpawnDTO> getSpawn(@PathVariable String spawnId) {
        return ResponseEntity.ok(spawnService.getSpawn(spawnId));
    }

    @PostMapping("/{spawnId}/claim")
    public ResponseEntity<ClaimResult> claim(@PathVariable String spawnId,
                                             @Valid @RequestBody ClaimRequest request) {
        return ResponseEntity.ok(spawnService.claim(spawnId, request.getUserId()));
    }
}
