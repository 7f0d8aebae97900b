package com.critter.controller;

import com.critter.dto.CreatureDTO;
import com.critter.dto.DailyRewardResult;
import com.critter.dto.InventoryItemDTO;
import com.critter.dto.PurchaseRequest;
import com.critter.dto.TeamRequest;
import com.critter.dto.TrainerDTO;
import com.critter.dto.TrainerRequest;
import com.critter.service.TrainerService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API controller for trainer profiles, teams, daily rewards and the item shop.
 */
@RestController
@RequestMapping("/api/trainers")
@RequiredArgsConstructor
@Slf4j
@CrossOrigin(origins = "*")
public class TrainerController {

    private final TrainerService trainerService;

    /**
     * Register a trainer, or return the existing one.
     */
    @PostMapping
    public ResponseEntity<TrainerDTO> register(@Valid @RequestBody TrainerRequest request) {
        return ResponseEntity.ok(TrainerDTO.fromTrainer(
                trainerService.getOrCreateTrainer(request.getUserId(), request.getDisplayName())));
    }

    @GetMapping("/leaderboard")
    public ResponseEntity<List<TrainerDTO>> getLeaderboard() {
        return ResponseEntity.ok(trainerService.getLeaderboard());
    }

    @GetMapping("/{userId}")
    public ResponseEntity<TrainerDTO> getProfile(@PathVariable Long userId) {
        return ResponseEntity.ok(trainerService.getProfile(userId));
    }

    @GetMapping("/{userId}/creatures")
    public ResponseEntity<List<CreatureDTO>> listCreatures(@PathVariable Long userId) {
        return ResponseEntity.ok(trainerService.listCreatures(userId));
    }

    @PutMapping("/{userId}/team")
    public ResponseEntity<TrainerDTO> setTeam(@PathVariable Long userId,
                                              @Valid @RequestBody TeamRequest request) {
        return ResponseEntity.ok(trainerService.setTeam(userId, request.getCreatureIds()));
    }

    @PostMapping("/{userId}/team/{creatureId}")
    public ResponseEntity<TrainerDTO> addToTeam(@PathVariable Long userId, @PathVariable String creatureId) {
        return ResponseEntity.ok(trainerService.addToTeam(userId, creatureId));
    }

    @DeleteMapping("/{userId}/team/{creatureId}")
    public ResponseEntity<TrainerDTO> removeFromTeam(@PathVariable Long userId, @PathVariable String creatureId) {
        return ResponseEntity.ok(trainerService.removeFromTeam(userId, creatureId));
    }

    @PostMapping("/{userId}/daily")
    public ResponseEntity<DailyRewardResult> claimDaily(@PathVariable Long userId) {
        return ResponseEntity.ok(trainerService.claimDaily(userId));
    }

    @GetMapping("/{userId}/inventory")
    public ResponseEntity<List<InventoryItemDTO>> getInventory(@PathVariable Long userId) {
        return ResponseEntity.ok(trainerService.getInventory(userId));
    }

    @PostMapping("/{userId}/shop")
    public ResponseEntity<List<InventoryItemDTO>> purchase(@PathVariable Long userId,
                                                           @Valid @RequestBody PurchaseRequest request) {
        log.info("Trainer {} buying {} x {}", userId, request.getQuantity(), request.getItemCode());
        return ResponseEntity.ok(trainerService.purchaseItem(userId, request.getItemCode(), request.getQuantity()));
    }
}
