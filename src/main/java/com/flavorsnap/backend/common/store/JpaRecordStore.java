package com.flavorsnap.backend.common.store;

import com.flavorsnap.backend.common.error.NotFoundException;
import com.flavorsnap.backend.common.error.StorageUnavailableException;
import jakarta.persistence.EntityManager;
import jakarta.persistence.LockModeType;
import jakarta.persistence.PersistenceException;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Root;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.ToLongFunction;
import java.util.function.Supplier;

/**
 * JPA engine: {@link #update} loads the row with {@code PESSIMISTIC_WRITE} (SELECT ... FOR UPDATE),
 * so the lock lives until the surrounding transaction commits.
 * 注意：需要在 @Transactional 內呼叫才會真的 lock（本類別的方法自己也會開 transaction）
 */
@Slf4j
public class JpaRecordStore<T extends StoredRecord<T>> implements RecordStore<T> {

    private static final String LOCK_TIMEOUT_HINT = "jakarta.persistence.lock.timeout";

    private final RecordKind kind;
    private final Class<T> entityType;
    private final JpaRepository<T, String> repo;
    private final JpaSpecificationExecutor<T> specs;
    private final EntityManager em;
    private final long lockTimeoutMs;

    public <R extends JpaRepository<T, String> & JpaSpecificationExecutor<T>> JpaRecordStore(
            RecordKind kind, Class<T> entityType, R repo, EntityManager em, Duration lockTimeout) {
        this.kind = kind;
        this.entityType = entityType;
        this.repo = repo;
        this.specs = repo;
        this.em = em;
        this.lockTimeoutMs = lockTimeout.toMillis();
    }

    @Override
    public RecordKind kind() {
        return kind;
    }

    @Override
    @Transactional
    public T create(T record) {
        if (record.getId() == null || record.getId().isBlank()) {
            record.setId(UUID.randomUUID().toString());
        }
        return translate("create", () -> {
            // ✅ 用 persist 而不是 save：assigned id 走 merge 會把重複 id 靜默覆蓋
            em.persist(record);
            em.flush();
            return record;
        });
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<T> find(String id) {
        if (id == null) return Optional.empty();
        return translate("find", () -> repo.findById(id));
    }

    @Override
    @Transactional(readOnly = true)
    public List<T> findAll(Collection<String> ids) {
        List<String> wanted = ids.stream().filter(id -> id != null).distinct().toList();
        if (wanted.isEmpty()) return List.of();
        return translate("findAll", () -> repo.findAllById(wanted));
    }

    @Override
    @Transactional(readOnly = true)
    public List<T> scan(StoreFilter<T> filter) {
        return translate("scan", () -> filter.isEmpty() ? repo.findAll() : specs.findAll(filter.toSpecification()));
    }

    @Override
    @Transactional(readOnly = true)
    public long count(StoreFilter<T> filter) {
        return translate("count", () -> filter.isEmpty() ? repo.count() : specs.count(filter.toSpecification()));
    }

    @Override
    @Transactional(readOnly = true)
    public long sum(String column, ToLongFunction<T> getter, StoreFilter<T> filter) {
        return translate("sum", () -> {
            CriteriaBuilder cb = em.getCriteriaBuilder();
            CriteriaQuery<Long> q = cb.createQuery(Long.class);
            Root<T> root = q.from(entityType);
            q.select(cb.sumAsLong(root.<Integer>get(column)));
            q.where(filter.toSpecification().toPredicate(root, q, cb));
            Long total = em.createQuery(q).getSingleResult();
            return total == null ? 0L : total;
        });
    }

    @Override
    @Transactional
    public T update(String id, Consumer<T> mutator) {
        if (id == null) throw new NotFoundException(kind.notFoundCode(), null);

        T locked = translate("lock", () -> em.find(entityType, id, LockModeType.PESSIMISTIC_WRITE,
                Map.of(LOCK_TIMEOUT_HINT, lockTimeoutMs)));
        if (locked == null) throw new NotFoundException(kind.notFoundCode(), id);

        mutator.accept(locked);
        locked.setId(id);

        // flush 在這裡做，讓 constraint / 連線錯誤在 store 內就被翻譯
        return translate("update", () -> {
            em.flush();
            return locked;
        });
    }

    private <R> R translate(String op, Supplier<R> action) {
        try {
            return action.get();
        } catch (PersistenceException | DataAccessException e) {
            log.error("store_failure kind={} op={} error={}", kind, op, e.getClass().getSimpleName(), e);
            throw new StorageUnavailableException("STORAGE_UNAVAILABLE", e);
        }
    }
}
