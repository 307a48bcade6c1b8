package com.example.orchestrator.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.example.orchestrator.config.OrchestratorProperties;
import com.example.orchestrator.domain.Conversation;
import com.example.orchestrator.event.OrchestratorEvent;
import com.example.orchestrator.event.OrchestratorEventPublisher;
import com.example.orchestrator.event.OrchestratorEventType;
import com.example.orchestrator.identity.PhoneNormalizer;
import com.example.orchestrator.service.exception.ServiceException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;

@ExtendWith(MockitoExtension.class)
class ConversationLocksTest {

    private static final String TENANT = "tenant-1";
    private static final String PHONE = "6285555555555";
    private static final String LOCK_KEY = "orchestrator:conversation:tenant-1:6285555555555:lock";

    @Mock
    private RedissonClient redissonClient;

    @Mock
    private RLock rLock;

    @Mock
    private OrchestratorEventPublisher eventPublisher;

    private final ReentrantLock backingLock = new ReentrantLock();
    private ConversationLocks locks;

    @BeforeEach
    void setUp() {
        lenient().when(redissonClient.getLock(anyString())).thenReturn(rLock);
        lenient().doAnswer(invocation -> {
            backingLock.lock();
            return null;
        }).when(rLock).lock();
        lenient().doAnswer(invocation -> {
            backingLock.unlock();
            return null;
        }).when(rLock).unlock();
        locks = new ConversationLocks(redissonClient, new RedisKeyFactory(new OrchestratorProperties()));
    }

    @Test
    void locksPerTenantAndPhone() {
        String result = locks.withLock(TENANT, PHONE, () -> "done");

        assertThat(result).isEqualTo("done");
        verify(redissonClient).getLock(LOCK_KEY);
        verify(rLock).lock();
        verify(rLock).unlock();
    }

    @Test
    void releasesLockWhenWorkFails() {
        assertThatThrownBy(() -> locks.withLock(TENANT, PHONE, () -> {
            throw new IllegalStateException("database down");
        })).isInstanceOf(IllegalStateException.class);

        verify(rLock).unlock();
        assertThat(backingLock.isLocked()).isFalse();
    }

    @Test
    void blankKeyIsRejected() {
        assertThatThrownBy(() -> locks.withLock(TENANT, " ", () -> "never"))
                .isInstanceOf(ServiceException.class);
        verifyNoInteractions(redissonClient);
    }

    @Test
    @DisplayName("Two simultaneous closing messages close the conversation once")
    void concurrentClosingFiresOnce() throws Exception {
        InMemoryConversationRepository repository = new InMemoryConversationRepository();
        ConversationStateMachine stateMachine = new ConversationStateMachine(repository, eventPublisher,
                new PhoneNormalizer(new OrchestratorProperties()));
        Conversation conversation = stateMachine.getOrCreate(TENANT, PHONE, false);
        stateMachine.escalate(conversation, "customer_inquiry");

        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < 2; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return locks.withLock(TENANT, PHONE, () -> {
                        maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                        try {
                            Conversation loaded = detached(repository.findByTenantAndPhone(TENANT, PHONE).orElseThrow());
                            pause();
                            return stateMachine.close(loaded, "tidak, terima kasih");
                        } finally {
                            inside.decrementAndGet();
                        }
                    });
                }));
            }
            start.countDown();

            int closed = 0;
            for (Future<Boolean> result : results) {
                if (result.get(5, TimeUnit.SECONDS)) {
                    closed++;
                }
            }
            assertThat(closed).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }

        assertThat(maxInside.get()).isEqualTo(1);
        ArgumentCaptor<OrchestratorEvent> events = ArgumentCaptor.forClass(OrchestratorEvent.class);
        verify(eventPublisher, atLeastOnce()).publishLifecycleEvent(events.capture());
        assertThat(events.getAllValues())
                .filteredOn(event -> event.getType() == OrchestratorEventType.CONVERSATION_CLOSED)
                .hasSize(1);
    }

    /** Each unit of work reads its own copy, as it would from the database. */
    private static Conversation detached(Conversation stored) {
        return Conversation.builder()
                .id(stored.getId())
                .tenantId(stored.getTenantId())
                .customerPhone(stored.getCustomerPhone())
                .staff(stored.isStaff())
                .conversationType(stored.getConversationType())
                .status(stored.getStatus())
                .escalatedAt(stored.getEscalatedAt())
                .closedAt(stored.getClosedAt())
                .createdAt(stored.getCreatedAt())
                .lastMessageAt(stored.getLastMessageAt())
                .context(stored.getContext())
                .version(stored.getVersion())
                .build();
    }

    private static void pause() {
        try {
            Thread.sleep(50);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(ex);
        }
    }
}
