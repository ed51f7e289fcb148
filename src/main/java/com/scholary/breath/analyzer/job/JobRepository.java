package com.scholary.breath.analyzer.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory repository for analysis jobs.
 *
 * <p>Backed by a Caffeine cache so finished jobs are evicted by size and age.
 */
@Repository
public class JobRepository {

  private final Cache<String, AnalysisJob> cache;

  public JobRepository(
      @Value("${jobstore.maxSize}") int maxSize,
      @Value("${jobstore.expireAfterMinutes}") int expireAfterMinutes) {

    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofMinutes(expireAfterMinutes))
            .build();
  }

  public void save(AnalysisJob job) {
    cache.put(job.getJobId(), job);
  }

  public Optional<AnalysisJob> findById(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId));
  }

  public void delete(String jobId) {
    cache.invalidate(jobId);
  }
}
