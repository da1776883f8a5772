package com.roomchat.room.dao;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import com.roomchat.room.exception.DuplicateClientException;
import com.roomchat.room.exception.MessageCapacityExceededException;
import com.roomchat.room.exception.ParticipantNotFoundException;
import com.roomchat.room.exception.RoomCapacityExceededException;
import com.roomchat.room.exception.SenderNotParticipantException;
import com.roomchat.room.model.ChatMessage;
import com.roomchat.room.model.ClientId;
import com.roomchat.room.model.MessageContent;
import com.roomchat.room.model.Participant;
import com.roomchat.room.model.RoomId;
import com.roomchat.room.model.RoomSnapshot;
import com.roomchat.room.model.Timestamp;

class InMemoryRoomStoreTest {

    private static final ClientId ALICE = ClientId.of("alice");
    private static final ClientId BOB = ClientId.of("bob");

    private InMemoryRoomStore newStore() {
        return new InMemoryRoomStore(RoomId.generate(), Timestamp.ofEpochMillis(0));
    }

    @Test
    void addsAndRemovesParticipants() {
        InMemoryRoomStore store = newStore();

        store.addParticipant(ALICE, Timestamp.ofEpochMillis(1_000));
        store.addParticipant(BOB, Timestamp.ofEpochMillis(2_000));

        assertThat(store.listParticipants()).containsExactly(ALICE, BOB);
        assertThat(store.participantCount()).isEqualTo(2);
        assertThat(store.findParticipant(ALICE)).map(Participant::getJoinedAt).contains(Timestamp.ofEpochMillis(1_000));

        Participant removed = store.removeParticipant(ALICE);

        assertThat(removed.getClientId()).isEqualTo(ALICE);
        assertThat(store.listParticipants()).containsExactly(BOB);
        assertThat(store.containsParticipant(ALICE)).isFalse();
    }

    @Test
    void rejectsDuplicateParticipantAndKeepsOriginal() {
        InMemoryRoomStore store = newStore();
        store.addParticipant(ALICE, Timestamp.ofEpochMillis(1_000));

        assertThatThrownBy(() -> store.addParticipant(ALICE, Timestamp.ofEpochMillis(5_000)))
                .isInstanceOf(DuplicateClientException.class);

        assertThat(store.participantCount()).isEqualTo(1);
        assertThat(store.findParticipant(ALICE).orElseThrow().getJoinedAt()).isEqualTo(Timestamp.ofEpochMillis(1_000));
    }

    @Test
    void secondRemoveReportsNotFound() {
        InMemoryRoomStore store = newStore();
        store.addParticipant(ALICE, Timestamp.ofEpochMillis(1_000));
        store.removeParticipant(ALICE);

        assertThatThrownBy(() -> store.removeParticipant(ALICE)).isInstanceOf(ParticipantNotFoundException.class);
        assertThat(store.participantCount()).isZero();
    }

    @Test
    void conditionalRemoveOnlyRemovesSameInstance() {
        InMemoryRoomStore store = newStore();
        Participant first = store.addParticipant(ALICE, Timestamp.ofEpochMillis(1_000));
        store.removeParticipant(ALICE);
        Participant second = store.addParticipant(ALICE, Timestamp.ofEpochMillis(1_000));

        assertThat(store.removeParticipantIfSame(first)).isFalse();
        assertThat(store.containsParticipant(ALICE)).isTrue();

        assertThat(store.removeParticipantIfSame(second)).isTrue();
        assertThat(store.containsParticipant(ALICE)).isFalse();
    }

    @Test
    void appendRequiresCurrentParticipant() {
        InMemoryRoomStore store = newStore();
        store.addParticipant(ALICE, Timestamp.ofEpochMillis(1_000));

        ChatMessage message = store.appendMessage(ALICE, MessageContent.of("hi"), Timestamp.ofEpochMillis(3_000));

        assertThat(message.getSequence()).isZero();
        assertThat(message.getSender()).isEqualTo(ALICE);
        assertThatThrownBy(() -> store.appendMessage(BOB, MessageContent.of("x"), Timestamp.ofEpochMillis(4_000)))
                .isInstanceOf(SenderNotParticipantException.class);
        assertThat(store.getMessages()).containsExactly(message);
    }

    @Test
    void messageLogSurvivesSenderLeaving() {
        InMemoryRoomStore store = newStore();
        store.addParticipant(ALICE, Timestamp.ofEpochMillis(1_000));
        store.appendMessage(ALICE, MessageContent.of("first"), Timestamp.ofEpochMillis(2_000));
        store.removeParticipant(ALICE);

        assertThat(store.getMessages()).extracting(m -> m.getContent().getValue()).containsExactly("first");
    }

    @Test
    void enforcesParticipantAndMessageCapacity() {
        InMemoryRoomStore store = new InMemoryRoomStore(RoomId.generate(), Timestamp.ofEpochMillis(0), 2, 2);
        store.addParticipant(ALICE, Timestamp.ofEpochMillis(1));
        store.addParticipant(BOB, Timestamp.ofEpochMillis(2));

        assertThatThrownBy(() -> store.addParticipant(ClientId.of("charlie"), Timestamp.ofEpochMillis(3)))
                .isInstanceOfSatisfying(RoomCapacityExceededException.class, e -> {
                    assertThat(e.getCapacity()).isEqualTo(2);
                    assertThat(e.getCurrent()).isEqualTo(2);
                });

        store.appendMessage(ALICE, MessageContent.of("1"), Timestamp.ofEpochMillis(4));
        store.appendMessage(BOB, MessageContent.of("2"), Timestamp.ofEpochMillis(5));
        assertThatThrownBy(() -> store.appendMessage(ALICE, MessageContent.of("3"), Timestamp.ofEpochMillis(6)))
                .isInstanceOf(MessageCapacityExceededException.class);
        assertThat(store.getMessages()).hasSize(2);
    }

    @Test
    void snapshotIsDetachedFromLiveState() {
        InMemoryRoomStore store = newStore();
        store.addParticipant(ALICE, Timestamp.ofEpochMillis(1));
        RoomSnapshot snapshot = store.snapshot();

        store.addParticipant(BOB, Timestamp.ofEpochMillis(2));

        assertThat(snapshot.getParticipants()).extracting(Participant::getClientId).containsExactly(ALICE);
        assertThat(store.getRoomId()).isEqualTo(snapshot.getRoomId());
    }

    @Test
    void concurrentAddsOfSameIdAdmitExactlyOne() throws Exception {
        InMemoryRoomStore store = newStore();
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                long joinedAt = i;
                futures.add(executor.submit(() -> {
                    start.await();
                    try {
                        store.addParticipant(ClientId.of("carol"), Timestamp.ofEpochMillis(joinedAt));
                        return true;
                    } catch (DuplicateClientException e) {
                        return false;
                    }
                }));
            }
            start.countDown();

            int admitted = 0;
            for (Future<Boolean> future : futures) {
                if (future.get(5, TimeUnit.SECONDS)) {
                    admitted++;
                }
            }
            assertThat(admitted).isEqualTo(1);
            assertThat(store.participantCount()).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void concurrentAppendsReceiveDistinctOrderedSequences() throws Exception {
        InMemoryRoomStore store = new InMemoryRoomStore(RoomId.generate(), Timestamp.ofEpochMillis(0), 10, 1_000);
        store.addParticipant(ALICE, Timestamp.ofEpochMillis(1));
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                String text = "m" + i;
                futures.add(executor.submit(() -> store.appendMessage(ALICE, MessageContent.of(text), Timestamp.ofEpochMillis(2))));
            }
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        List<ChatMessage> messages = store.getMessages();
        assertThat(messages).hasSize(200);
        for (int i = 0; i < messages.size(); i++) {
            assertThat(messages.get(i).getSequence()).isEqualTo(i);
        }
    }
}
