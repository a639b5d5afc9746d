package com.radiochat.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.radiochat.model.ServerEvent;
import com.radiochat.model.ServerEventType;
import com.radiochat.model.SpeakerResponse;
import com.radiochat.model.TalkState;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PttArbiterTest {

    private RecordingNotifier notifier;
    private MembershipCoordinator coordinator;
    private PttArbiter arbiter;

    @BeforeEach
    void setUp() {
        ChatStateLock lock = new ChatStateLock();
        notifier = new RecordingNotifier();
        RoomRegistry roomRegistry = new RoomRegistry(ChatFixtures.properties(), lock);
        coordinator = new MembershipCoordinator(roomRegistry, lock, notifier);
        arbiter = new PttArbiter(roomRegistry, lock, notifier, ChatFixtures.clock());
        coordinator.join("c1", "u1", "Ana", "handy");
        coordinator.join("c2", "u2", "Luis", "handy");
        notifier.clear();
    }

    @Test
    void everyRoomStartsIdle() {
        assertThat(arbiter.stateOf("lobby")).isSameAs(TalkState.IDLE);
        assertThat(arbiter.stateOf("general")).isSameAs(TalkState.IDLE);
        assertThat(arbiter.currentSpeaker("handy")).isEmpty();
    }

    @Test
    void idleRoomGrantsAndAnnouncesSpeaker() {
        PttArbiter.TalkOutcome outcome = arbiter.requestToken("c1", "handy", "u1", "Ana");

        assertThat(outcome.isGranted()).isTrue();
        assertThat(arbiter.currentSpeaker("handy")).hasValueSatisfying(held -> {
            assertThat(held.getHolderId()).isEqualTo("u1");
            assertThat(held.getSince()).isEqualTo(ChatFixtures.NOW);
        });
        assertThat(notifier.eventsTo("c1", ServerEventType.TOKEN_GRANTED)).hasSize(1);
        assertThat(notifier.eventsTo("c2", ServerEventType.CURRENT_SPEAKER_UPDATE)).singleElement()
                .satisfies(event -> assertThat(((SpeakerResponse) event.get("speaker")).getUserId()).isEqualTo("u1"));
    }

    @Test
    void heldRoomDeniesWithoutChangingHolder() {
        arbiter.requestToken("c1", "handy", "u1", "Ana");

        PttArbiter.TalkOutcome outcome = arbiter.requestToken("c2", "handy", "u2", "Luis");

        assertThat(outcome.getResult()).isEqualTo(PttArbiter.TalkOutcome.Result.DENIED);
        assertThat(outcome.getHolder()).hasValueSatisfying(held -> assertThat(held.getHolderId()).isEqualTo("u1"));
        assertThat(arbiter.currentSpeaker("handy").map(TalkState.Held::getHolderId)).contains("u1");
        List<ServerEvent> denials = notifier.eventsTo("c2", ServerEventType.TOKEN_DENIED);
        assertThat(denials).singleElement().satisfies(event ->
                assertThat(((SpeakerResponse) event.get("currentSpeaker")).getUsername()).isEqualTo("Ana"));
    }

    @Test
    void holderRequestingAgainIsDenied() {
        arbiter.requestToken("c1", "handy", "u1", "Ana");

        PttArbiter.TalkOutcome outcome = arbiter.requestToken("c1", "handy", "u1", "Ana");

        assertThat(outcome.isGranted()).isFalse();
        assertThat(arbiter.currentSpeaker("handy")).isPresent();
    }

    @Test
    void unknownRoomOrMissingUserIsIgnored() {
        assertThat(arbiter.requestToken("c1", "mars", "u1", "Ana").getResult())
                .isEqualTo(PttArbiter.TalkOutcome.Result.IGNORED);
        assertThat(arbiter.requestToken("c1", "handy", "", "Ana").getResult())
                .isEqualTo(PttArbiter.TalkOutcome.Result.IGNORED);
        assertThat(notifier.deliveries()).isEmpty();
    }

    @Test
    void onlyHolderCanRelease() {
        arbiter.requestToken("c1", "handy", "u1", "Ana");
        notifier.clear();

        assertThat(arbiter.releaseToken("handy", "u2")).isFalse();
        assertThat(arbiter.currentSpeaker("handy")).isPresent();
        assertThat(notifier.deliveries()).isEmpty();

        assertThat(arbiter.releaseToken("handy", "u1")).isTrue();
        assertThat(arbiter.stateOf("handy")).isSameAs(TalkState.IDLE);
        assertThat(notifier.eventsTo("c2", ServerEventType.TOKEN_RELEASED)).hasSize(1);
        assertThat(notifier.eventsTo("c2", ServerEventType.CURRENT_SPEAKER_UPDATE)).singleElement()
                .satisfies(event -> {
                    assertThat(event.getFields()).containsKey("speaker");
                    assertThat(event.get("speaker")).isNull();
                });
    }

    @Test
    void releaseOnIdleRoomIsNoOp() {
        assertThat(arbiter.releaseToken("handy", "u1")).isFalse();
        assertThat(arbiter.releaseToken("mars", "u1")).isFalse();
        assertThat(notifier.deliveries()).isEmpty();
    }

    @Test
    void forceReleaseFreesTokenForNextRequester() {
        arbiter.requestToken("c1", "handy", "u1", "Ana");

        assertThat(arbiter.forceRelease("u1")).containsExactly("handy");
        assertThat(arbiter.forceRelease("u1")).isEmpty();

        assertThat(arbiter.requestToken("c2", "handy", "u2", "Luis").isGranted()).isTrue();
    }

    @Test
    void closingGrantingConnectionReleasesToken() {
        arbiter.requestToken("c9", "handy", "u9", "Eva");

        assertThat(arbiter.releaseGrantedThrough("c2")).isEmpty();
        assertThat(arbiter.releaseGrantedThrough("c9")).containsExactly("handy");

        assertThat(arbiter.stateOf("handy")).isSameAs(TalkState.IDLE);
        assertThat(notifier.eventsTo("c1", ServerEventType.TOKEN_RELEASED)).singleElement()
                .satisfies(event -> assertThat(event.get("userId")).isEqualTo("u9"));
    }

    @Test
    void movedHolderSurvivesCloseOfOldConnection() {
        arbiter.requestToken("c1", "handy", "u1", "Ana");

        arbiter.moveHolder("u1", "c5");

        assertThat(arbiter.releaseGrantedThrough("c1")).isEmpty();
        assertThat(arbiter.currentSpeaker("handy")).hasValueSatisfying(held -> {
            assertThat(held.getConnectionId()).isEqualTo("c5");
            assertThat(held.getSince()).isEqualTo(ChatFixtures.NOW);
        });
        assertThat(arbiter.releaseGrantedThrough("c5")).containsExactly("handy");
    }

    @Test
    void concurrentRequestsGrantExactlyOnce() throws Exception {
        int requesters = 16;
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<PttArbiter.TalkOutcome>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < requesters; i++) {
                String userId = "user-" + i;
                futures.add(executor.submit(() -> {
                    start.await();
                    return arbiter.requestToken("conn-" + userId, "handy", userId, userId);
                }));
            }
            start.countDown();
            int granted = 0;
            for (Future<PttArbiter.TalkOutcome> future : futures) {
                if (future.get(5, TimeUnit.SECONDS).isGranted()) {
                    granted++;
                }
            }
            assertThat(granted).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }
}
