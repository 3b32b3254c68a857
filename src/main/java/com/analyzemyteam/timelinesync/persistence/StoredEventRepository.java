package com.analyzemyteam.timelinesync.persistence;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.NoRepositoryBean;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/**
 * Operations shared by the per-kind event repositories.
 *
 * @param <T> entity type of one event table
 */
@NoRepositoryBean
public interface StoredEventRepository<T extends StoredEventEntity> extends Repository<T, String> {

    T save(T entity);

    Optional<T> findById(String id);

    void deleteById(String id);

    long count();

    @Query("select e from #{#entityName} e order by e.videoTimestamp desc")
    List<T> findLatest(Pageable pageable);

    @Modifying
    @Query("delete from #{#entityName} e where e.ingestTimestamp < :cutoff and e.userCreated = false")
    int deleteIngestedBefore(@Param("cutoff") long cutoff);
}
