package com.critter.websocket;

import com.critter.dto.BattleStateDTO;
import com.critter.dto.TradeDTO;
import com.critter.event.BattleCompletedEvent;
import com.critter.event.CreatureCaughtEvent;
import com.critter.event.CreatureEvolvedEvent;
import com.critter.event.SpawnAppearedEvent;
import com.critter.event.TradeSettledEvent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Pushes engine events to STOMP subscribers. Chat-scoped events go to {@code /topic/chat/{chatId}},
 * trainer-scoped ones to {@code /topic/trainer/{trainerId}}. Delivery is best effort.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChatEventBroadcaster {

    static final String CHAT_TOPIC = "/topic/chat/";
    static final String TRAINER_TOPIC = "/topic/trainer/";

    private final SimpMessagingTemplate messagingTemplate;

    @Async("eventExecutor")
    @EventListener
    public void onSpawnAppeared(SpawnAppearedEvent event) {
        send(CHAT_TOPIC + event.spawn().getChatId(), GameMessage.of("SPAWN_APPEARED", event.spawn()));
    }

    @Async("eventExecutor")
    @EventListener
    public void onCreatureCaught(CreatureCaughtEvent event) {
        GameMessage message = GameMessage.of("CREATURE_CAUGHT", event);
        send(CHAT_TOPIC + event.chatId(), message);
        send(TRAINER_TOPIC + event.trainerId(), message);
    }

    @Async("eventExecutor")
    @EventListener
    public void onCreatureEvolved(CreatureEvolvedEvent event) {
        send(TRAINER_TOPIC + event.ownerId(), GameMessage.of("CREATURE_EVOLVED", event));
    }

    @Async("eventExecutor")
    @EventListener
    public void onBattleCompleted(BattleCompletedEvent event) {
        BattleStateDTO battle = event.battle();
        GameMessage message = GameMessage.of("BATTLE_COMPLETED", battle);
        send(TRAINER_TOPIC + battle.getChallengerId(), message);
        if (battle.getOpponentId() != null) {
            send(TRAINER_TOPIC + battle.getOpponentId(), message);
        }
    }

    @Async("eventExecutor")
    @EventListener
    public void onTradeSettled(TradeSettledEvent event) {
        TradeDTO trade = event.trade();
        GameMessage message = GameMessage.of("TRADE_" + trade.getStatus(), trade);
        send(TRAINER_TOPIC + trade.getProposerId(), message);
        send(TRAINER_TOPIC + trade.getCounterpartyId(), message);
    }

    private void send(String destination, GameMessage message) {
        try {
            messagingTemplate.convertAndSend(destination, message);
            log.debug("Sent {} to {}", message.getType(), destination);
        } catch (MessagingException e) {
            log.warn("Failed to send {} to {}: {}", message.getType(), destination, e.getMessage());
        }
    }

    /**
     * Generic message wrapper.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class GameMessage {
        private String type;
        private Object payload;
        private long timestamp;

        public static GameMessage of(String type, Object payload) {
            return GameMessage.builder()
                    .type(type)
                    .payload(payload)
                    .timestamp(System.currentTimeMillis())
                    .build();
        }
    }
}
