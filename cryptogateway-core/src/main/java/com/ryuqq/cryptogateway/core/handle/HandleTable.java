package com.ryuqq.cryptogateway.core.handle;

import com.ryuqq.cryptogateway.core.error.HandleBusyException;
import com.ryuqq.cryptogateway.core.error.InvalidHandleException;
import com.ryuqq.cryptogateway.core.model.HandleKind;
import com.ryuqq.cryptogateway.core.model.ManagedObject;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

/**
 * 불투명 핸들 테이블.
 *
 * <p>호스트에 노출되는 정수 핸들과 내부 객체를 연결합니다. 핸들은 슬롯 번호와 세대(generation)를
 * 합친 {@code long} 값이므로, 폐기된 슬롯이 재사용되어도 이전 핸들은 계속 무효로 판정됩니다.</p>
 *
 * <p><strong>핸들 인코딩:</strong></p>
 * <pre>
 * handle = (generation &lt;&lt; 32) | (slotIndex + 1)
 * </pre>
 * <p>하위 32비트가 항상 1 이상이므로 0은 발급되지 않습니다.</p>
 *
 * <p><strong>소유 관계:</strong> 키/해시는 프로바이더의 자식으로만 생성되며, 프로바이더를 폐기하면
 * 자식이 먼저 모두 폐기됩니다 (cascade).</p>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>조회(resolve, lease)는 읽기 잠금, 생성/폐기는 쓰기 잠금</li>
 *   <li>{@link #lease}는 항목별 플래그로 한 작업만 핸들을 사용하게 하며, 두 번째 호출자는
 *       기다리지 않고 {@link HandleBusyException}으로 실패</li>
 * </ul>
 *
 * @author CryptoGateway Team
 * @since 1.0.0
 */
public final class HandleTable {

    private static final long NO_PARENT = 0L;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<Slot> slots = new ArrayList<>();
    private final Deque<Integer> freeSlots = new ArrayDeque<>();
    private int liveCount;

    /**
     * 최상위 객체 등록 (프로바이더).
     *
     * @param payload 등록할 객체
     * @return 새 핸들 (0이 아님)
     */
    public long create(ManagedObject payload) {
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        lock.writeLock().lock();
        try {
            return allocate(payload, NO_PARENT);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 프로바이더 소유의 자식 객체 등록 (키, 해시).
     *
     * @param parentHandle 프로바이더 핸들
     * @param payload 등록할 객체
     * @return 새 핸들
     * @throws InvalidHandleException 부모가 유효한 프로바이더 핸들이 아닌 경우
     */
    public long createChild(long parentHandle, ManagedObject payload) {
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        if (payload.kind() == HandleKind.PROVIDER) {
            throw new IllegalArgumentException("provider cannot be a child");
        }
        lock.writeLock().lock();
        try {
            Entry parent = find(parentHandle);
            requireKind(parent, parentHandle, HandleKind.PROVIDER);
            long handle = allocate(payload, parentHandle);
            parent.children.add(handle);
            return handle;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 핸들 조회.
     *
     * @param handle 핸들
     * @param expectedKind 기대하는 종류
     * @param type 객체 타입
     * @param <T> 객체 타입
     * @return 객체
     * @throws InvalidHandleException 핸들이 없거나, 폐기되었거나, 종류가 다른 경우
     */
    public <T extends ManagedObject> T resolve(long handle, HandleKind expectedKind, Class<T> type) {
        lock.readLock().lock();
        try {
            Entry entry = find(handle);
            requireKind(entry, handle, expectedKind);
            return type.cast(entry.payload);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 자식 핸들이 주어진 프로바이더 소유인지 확인.
     *
     * @param providerHandle 프로바이더 핸들
     * @param childHandle 키/해시 핸들
     * @throws InvalidHandleException 소유 관계가 아니거나 핸들이 무효한 경우
     */
    public void requireOwnedBy(long providerHandle, long childHandle) {
        lock.readLock().lock();
        try {
            Entry child = find(childHandle);
            if (child.parent != providerHandle) {
                throw new InvalidHandleException(childHandle,
                    "not owned by provider 0x" + Long.toHexString(providerHandle));
            }
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 핸들 독점 사용 시작.
     *
     * <p>반환된 리스를 닫을 때까지 같은 핸들에 대한 다른 lease와 직접 retire는
     * {@link HandleBusyException}으로 실패합니다. 프로바이더 폐기에 의한 cascade는 리스와 무관하게 진행됩니다.</p>
     *
     * @param handle 핸들
     * @param expectedKind 기대하는 종류
     * @param type 객체 타입
     * @param <T> 객체 타입
     * @return 리스 (try-with-resources로 닫을 것)
     * @throws InvalidHandleException 핸들이 무효한 경우
     * @throws HandleBusyException 이미 다른 작업이 사용 중인 경우
     */
    public <T extends ManagedObject> HandleLease<T> lease(long handle, HandleKind expectedKind, Class<T> type) {
        lock.readLock().lock();
        try {
            Entry entry = find(handle);
            requireKind(entry, handle, expectedKind);
            if (!entry.leased.compareAndSet(false, true)) {
                throw new HandleBusyException(handle);
            }
            return new HandleLease<>(this, handle, type.cast(entry.payload), entry.leased);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 핸들 폐기.
     *
     * <p>프로바이더를 폐기하면 자식이 먼저 모두 폐기됩니다. 폐기 후 같은 핸들에 대한 모든 조회와
     * 두 번째 폐기는 {@link InvalidHandleException}입니다.</p>
     *
     * @param handle 핸들
     * @return 폐기된 객체 목록 (자식 먼저, 자신 마지막)
     * @throws InvalidHandleException 핸들이 무효한 경우
     * @throws HandleBusyException 다른 작업이 리스 중인 키/해시 핸들인 경우
     */
    public List<ManagedObject> retire(long handle) {
        lock.writeLock().lock();
        try {
            Entry entry = find(handle);
            if (entry.leased.get()) {
                throw new HandleBusyException(handle);
            }
            return retireLocked(handle, entry);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 리스 보유자가 자신이 리스한 핸들을 폐기.
     */
    void retireLeased(long handle, AtomicBoolean leaseFlag) {
        lock.writeLock().lock();
        try {
            Entry entry = find(handle);
            if (entry.leased != leaseFlag) {
                throw new InvalidHandleException(handle, "lease no longer matches handle");
            }
            retireLocked(handle, entry);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 자식 핸들 목록.
     *
     * @param providerHandle 프로바이더 핸들
     * @return 생성 순서대로 정렬된 자식 핸들 스냅샷
     * @throws InvalidHandleException 핸들이 무효한 경우
     */
    public List<Long> childrenOf(long providerHandle) {
        lock.readLock().lock();
        try {
            Entry entry = find(providerHandle);
            return List.copyOf(entry.children);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 조건에 맞는 첫 번째 자식 객체 검색.
     *
     * @param providerHandle 프로바이더 핸들
     * @param type 찾을 객체 타입
     * @param filter 조건
     * @param <T> 객체 타입
     * @return 생성 순서상 처음 일치하는 객체
     * @throws InvalidHandleException 핸들이 무효한 경우
     */
    public <T extends ManagedObject> Optional<T> findChild(long providerHandle, Class<T> type, Predicate<T> filter) {
        lock.readLock().lock();
        try {
            Entry entry = find(providerHandle);
            for (Long child : entry.children) {
                Entry childEntry = lookup(child);
                if (childEntry != null && type.isInstance(childEntry.payload)) {
                    T payload = type.cast(childEntry.payload);
                    if (filter.test(payload)) {
                        return Optional.of(payload);
                    }
                }
            }
            return Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 핸들이 현재 유효한지 확인.
     *
     * @param handle 핸들
     * @return 유효하면 true
     */
    public boolean contains(long handle) {
        lock.readLock().lock();
        try {
            return lookup(handle) != null;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 유효한 핸들 수.
     *
     * @return 살아 있는 항목 수
     */
    public int size() {
        lock.readLock().lock();
        try {
            return liveCount;
        } finally {
            lock.readLock().unlock();
        }
    }

    // ========================================
    // 내부 구현 (호출자가 잠금을 보유)
    // ========================================

    private long allocate(ManagedObject payload, long parent) {
        Slot slot;
        Integer free = freeSlots.pollFirst();
        if (free != null) {
            slot = slots.get(free);
        } else {
            slot = new Slot(slots.size());
            slots.add(slot);
        }
        long handle = encode(slot.generation, slot.index);
        slot.entry = new Entry(payload, parent);
        liveCount++;
        return handle;
    }

    private List<ManagedObject> retireLocked(long handle, Entry entry) {
        List<ManagedObject> retired = new ArrayList<>();
        for (Long child : List.copyOf(entry.children)) {
            Entry childEntry = lookup(child);
            if (childEntry != null) {
                retired.addAll(retireLocked(child, childEntry));
            }
        }
        if (entry.parent != NO_PARENT) {
            Entry parent = lookup(entry.parent);
            if (parent != null) {
                parent.children.remove(handle);
            }
        }
        Slot slot = slots.get(slotIndex(handle));
        slot.entry = null;
        slot.generation = slot.generation == Integer.MAX_VALUE ? 1 : slot.generation + 1;
        freeSlots.addLast(slot.index);
        liveCount--;
        retired.add(entry.payload);
        return retired;
    }

    private Entry find(long handle) {
        Entry entry = lookup(handle);
        if (entry == null) {
            throw new InvalidHandleException(handle, handle == 0 ? "null handle" : "unknown or retired handle");
        }
        return entry;
    }

    private Entry lookup(long handle) {
        int index = slotIndex(handle);
        if (index < 0 || index >= slots.size()) {
            return null;
        }
        Slot slot = slots.get(index);
        if (slot.entry == null || slot.generation != generation(handle)) {
            return null;
        }
        return slot.entry;
    }

    private static void requireKind(Entry entry, long handle, HandleKind expected) {
        HandleKind actual = entry.payload.kind();
        if (actual != expected) {
            throw new InvalidHandleException(handle, "expected " + expected + " handle but was " + actual);
        }
    }

    static long encode(int generation, int index) {
        return ((long) generation << 32) | (index + 1L);
    }

    static int slotIndex(long handle) {
        return (int) (handle & 0xFFFFFFFFL) - 1;
    }

    static int generation(long handle) {
        return (int) (handle >>> 32);
    }

    private static final class Slot {
        private final int index;
        private int generation = 1;
        private Entry entry;

        private Slot(int index) {
            this.index = index;
        }
    }

    private static final class Entry {
        private final ManagedObject payload;
        private final long parent;
        private final Set<Long> children = new LinkedHashSet<>();
        private final AtomicBoolean leased = new AtomicBoolean(false);

        private Entry(ManagedObject payload, long parent) {
            this.payload = payload;
            this.parent = parent;
        }
    }
}
