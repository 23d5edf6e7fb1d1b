package com.scholary.podcast.job;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

/** MongoDB implementation of {@link BulkJobRepository}. */
@Repository
public class MongoBulkJobRepository implements BulkJobRepository {

  private final MongoTemplate mongoTemplate;

  public MongoBulkJobRepository(MongoTemplate mongoTemplate) {
    this.mongoTemplate = mongoTemplate;
  }

  @Override
  public void save(BulkJob job) {
    job.setUpdatedAt(Instant.now());
    mongoTemplate.save(job);
  }

  @Override
  public Optional<BulkJob> findByJobId(String jobId) {
    return Optional.ofNullable(
        mongoTemplate.findOne(Query.query(Criteria.where("job_id").is(jobId)), BulkJob.class));
  }

  @Override
  public List<BulkJob> findRecent(int limit) {
    Query query = new Query().with(Sort.by(Sort.Direction.DESC, "created_at")).limit(limit);
    return mongoTemplate.find(query, BulkJob.class);
  }
}
