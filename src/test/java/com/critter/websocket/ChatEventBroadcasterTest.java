package com.critter.websocket;

import com.critter.dto.BattleStateDTO;
import com.critter.dto.SpawnDTO;
import com.critter.dto.TradeDTO;
import com.critter.event.BattleCompletedEvent;
import com.critter.event.CreatureCaughtEvent;
import com.critter.event.CreatureEvolvedEvent;
import com.critter.event.SpawnAppearedEvent;
import com.critter.event.TradeSettledEvent;
import com.critter.model.TradeStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ChatEventBroadcaster.
 */
@ExtendWith(MockitoExtension.class)
class ChatEventBroadcasterTest {

    @Mock private SimpMessagingTemplate messagingTemplate;

    private ChatEventBroadcaster broadcaster;

    @BeforeEach
    void setUp() {
        broadcaster = new ChatEventBroadcaster(messagingTemplate);
    }

    @Test
    @DisplayName("should announce a spawn to its chat topic")
    void shouldSendSpawnToChat() {
        SpawnDTO spawn = SpawnDTO.builder().id("s-1").chatId(100L).speciesCode("pidgey").build();

        broadcaster.onSpawnAppeared(new SpawnAppearedEvent(spawn));

        ArgumentCaptor<String> destCaptor = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<Object> msgCaptor = ArgumentCaptor.forClass(Object.class);
        verify(messagingTemplate).convertAndSend(destCaptor.capture(), msgCaptor.capture());

        assertEquals("/topic/chat/100", destCaptor.getValue());
        ChatEventBroadcaster.GameMessage msg = (ChatEventBroadcaster.GameMessage) msgCaptor.getValue();
        assertEquals("SPAWN_APPEARED", msg.getType());
        assertSame(spawn, msg.getPayload());
        assertTrue(msg.getTimestamp() > 0);
    }

    @Test
    @DisplayName("a catch should reach both the chat and the catcher")
    void shouldSendCatchToChatAndTrainer() {
        broadcaster.onCreatureCaught(new CreatureCaughtEvent(100L, "s-1", 7L, null));

        ArgumentCaptor<String> destCaptor = ArgumentCaptor.forClass(String.class);
        verify(messagingTemplate, times(2)).convertAndSend(destCaptor.capture(), any(Object.class));
        assertEquals(List.of("/topic/chat/100", "/topic/trainer/7"), destCaptor.getAllValues());
    }

    @Test
    @DisplayName("an evolution should go to the owner")
    void shouldSendEvolutionToOwner() {
        broadcaster.onCreatureEvolved(new CreatureEvolvedEvent("c-1", 7L, "pidgey", "pidgeotto", 18));

        verify(messagingTemplate).convertAndSend(eq("/topic/trainer/7"), any(Object.class));
    }

    @Test
    @DisplayName("a battle against a generated team should notify only the challenger")
    void shouldSkipMissingOpponent() {
        BattleStateDTO battle = BattleStateDTO.builder().id("b-1").challengerId(1L).build();

        broadcaster.onBattleCompleted(new BattleCompletedEvent(battle));

        verify(messagingTemplate).convertAndSend(eq("/topic/trainer/1"), any(Object.class));
        verifyNoMoreInteractions(messagingTemplate);
    }

    @Test
    @DisplayName("a trade outcome should be typed by its final status")
    void shouldTypeTradeByStatus() {
        TradeDTO trade = TradeDTO.builder().id("t-1").proposerId(1L).counterpartyId(2L).status(TradeStatus.EXPIRED).build();

        broadcaster.onTradeSettled(new TradeSettledEvent(trade));

        ArgumentCaptor<Object> msgCaptor = ArgumentCaptor.forClass(Object.class);
        verify(messagingTemplate, times(2)).convertAndSend(anyString(), msgCaptor.capture());
        assertEquals("TRADE_EXPIRED", ((ChatEventBroadcaster.GameMessage) msgCaptor.getValue()).getType());
    }

    @Test
    @DisplayName("a failed delivery should not stop the other recipients")
    void shouldSurviveDeliveryFailure() {
        TradeDTO trade = TradeDTO.builder().id("t-1").proposerId(1L).counterpartyId(2L).status(TradeStatus.CONFIRMED).build();
        doThrow(new MessageDeliveryException("broker down"))
                .when(messagingTemplate).convertAndSend(eq("/topic/trainer/1"), any(Object.class));

        assertDoesNotThrow(() -> broadcaster.onTradeSettled(new TradeSettledEvent(trade)));
        verify(messagingTemplate).convertAndSend(eq("/topic/trainer/2"), any(Object.class));
    }
}
