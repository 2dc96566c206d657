package com.acme.mailflow.broker.redis;

import com.acme.mailflow.core.Jsons;
import com.acme.mailflow.core.TransientException;
import com.acme.mailflow.queue.QueueName;
import com.acme.mailflow.spi.JobState;
import com.acme.mailflow.spi.JobStore;
import com.acme.mailflow.spi.StallRecovery;
import com.acme.mailflow.spi.StoredJob;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import org.redisson.api.BatchOptions;
import org.redisson.api.RBatch;
import org.redisson.api.RRateLimiter;
import org.redisson.api.RScript;
import org.redisson.api.RateIntervalUnit;
import org.redisson.api.RateType;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisException;
import org.redisson.client.codec.StringCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Job store on Redis. Adding, claiming and stalled-job recovery run as Lua scripts so several
 * worker processes can share a queue; other multi-key updates go through an atomic batch.
 *
 * <p>The {@link RedissonClient} is owned by the caller and is not shut down by {@link #close()}.
 */
public class RedissonJobStore implements JobStore {

  private static final Logger LOG = LoggerFactory.getLogger(RedissonJobStore.class);

  // KEYS: jobs, waiting. ARGV: job id, job json, run-at millis.
  private static final String ADD_SCRIPT =
      """
      if redis.call('HSETNX', KEYS[1], ARGV[1], ARGV[2]) == 0 then
        return 0
      end
      redis.call('ZADD', KEYS[2], ARGV[3], ARGV[1])
      return 1
      """;

  // KEYS: waiting, active, jobs. ARGV: now millis, lease-until millis.
  private static final String CLAIM_SCRIPT =
      """
      local ids = redis.call('ZRANGEBYSCORE', KEYS[1], '-inf', ARGV[1], 'LIMIT', 0, 1)
      if #ids == 0 then
        return false
      end
      redis.call('ZREM', KEYS[1], ids[1])
      redis.call('ZADD', KEYS[2], ARGV[2], ids[1])
      return redis.call('HGET', KEYS[3], ids[1])
      """;

  // KEYS: active, waiting, jobs, dead. ARGV: now millis, error.
  // Returns the requeued count followed by the json of every job moved to the dead set.
  private static final String RECOVER_SCRIPT =
      """
      local ids = redis.call('ZRANGEBYSCORE', KEYS[1], '-inf', '(' .. ARGV[1])
      local result = {'0'}
      local requeued = 0
      for _, id in ipairs(ids) do
        redis.call('ZREM', KEYS[1], id)
        local json = redis.call('HGET', KEYS[3], id)
        if json then
          local job = cjson.decode(json)
          local attempts = (tonumber(job['attemptsMade']) or 0) + 1
          job['attemptsMade'] = attempts
          job['lastError'] = ARGV[2]
          local updated = cjson.encode(job)
          redis.call('HSET', KEYS[3], id, updated)
          if attempts >= (tonumber(job['maxAttempts']) or 1) then
            redis.call('ZADD', KEYS[4], ARGV[1], id)
            table.insert(result, updated)
          else
            redis.call('ZADD', KEYS[2], ARGV[1], id)
            requeued = requeued + 1
          end
        end
      end
      result[1] = tostring(requeued)
      return result
      """;

  static final String STALLED_ERROR = "Job lease expired before it finished";

  private final RedissonClient redisson;
  private final Clock clock;
  private final Map<QueueName, RateSlot> limiters = new ConcurrentHashMap<>();

  private record RateSlot(RRateLimiter limiter, long permitsPerSecond) {}

  public RedissonJobStore(RedissonClient redisson, Clock clock) {
    this.redisson = redisson;
    this.clock = clock;
  }

  @Override
  public boolean add(StoredJob job, Instant runAt) {
    return call("add job " + job.jobId(), () -> {
      Boolean stored =
          redisson.getScript(StringCodec.INSTANCE).eval(
              RScript.Mode.READ_WRITE,
              ADD_SCRIPT,
              RScript.ReturnType.BOOLEAN,
              List.<Object>of(RedisKeys.jobs(job.queue()), RedisKeys.waiting(job.queue())),
              job.jobId(),
              Jsons.toJson(job),
              String.valueOf(runAt.toEpochMilli()));
      if (!Boolean.TRUE.equals(stored)) {
        LOG.debug("Job {} already known on {}, not enqueued", job.jobId(), job.queue());
        return false;
      }
      return true;
    });
  }

  @Override
  public Optional<StoredJob> claimNext(QueueName queue, Instant now, Instant leaseUntil) {
    return call("claim on " + queue, () -> {
      String json =
          redisson.getScript(StringCodec.INSTANCE).eval(
              RScript.Mode.READ_WRITE,
              CLAIM_SCRIPT,
              RScript.ReturnType.VALUE,
              List.<Object>of(RedisKeys.waiting(queue), RedisKeys.active(queue), RedisKeys.jobs(queue)),
              String.valueOf(now.toEpochMilli()),
              String.valueOf(leaseUntil.toEpochMilli()));
      return Optional.ofNullable(json).map(j -> Jsons.fromJson(j, StoredJob.class));
    });
  }

  @Override
  public void complete(QueueName queue, String jobId) {
    call("complete job " + jobId, () -> {
      RBatch batch = atomicBatch();
      batch.getScoredSortedSet(RedisKeys.active(queue), StringCodec.INSTANCE).removeAsync(jobId);
      batch.getScoredSortedSet(RedisKeys.waiting(queue), StringCodec.INSTANCE).removeAsync(jobId);
      batch.getMap(RedisKeys.jobs(queue), StringCodec.INSTANCE).fastRemoveAsync(jobId);
      batch.execute();
      return null;
    });
  }

  @Override
  public void release(StoredJob job, Instant runAt) {
    call("release job " + job.jobId(), () -> {
      RBatch batch = atomicBatch();
      batch.getScoredSortedSet(RedisKeys.active(job.queue()), StringCodec.INSTANCE)
          .removeAsync(job.jobId());
      batch.getMap(RedisKeys.jobs(job.queue()), StringCodec.INSTANCE)
          .fastPutAsync(job.jobId(), Jsons.toJson(job));
      batch.getScoredSortedSet(RedisKeys.waiting(job.queue()), StringCodec.INSTANCE)
          .addAsync(runAt.toEpochMilli(), job.jobId());
      batch.execute();
      return null;
    });
  }

  @Override
  public void markDead(StoredJob job) {
    call("mark job dead " + job.jobId(), () -> {
      RBatch batch = atomicBatch();
      batch.getScoredSortedSet(RedisKeys.active(job.queue()), StringCodec.INSTANCE)
          .removeAsync(job.jobId());
      batch.getScoredSortedSet(RedisKeys.waiting(job.queue()), StringCodec.INSTANCE)
          .removeAsync(job.jobId());
      batch.getMap(RedisKeys.jobs(job.queue()), StringCodec.INSTANCE)
          .fastPutAsync(job.jobId(), Jsons.toJson(job));
      batch.getScoredSortedSet(RedisKeys.dead(job.queue()), StringCodec.INSTANCE)
          .addAsync(clock.millis(), job.jobId());
      batch.execute();
      return null;
    });
  }

  @Override
  public StallRecovery recoverStalled(QueueName queue, Instant now) {
    return call("recover stalled jobs on " + queue, () -> {
      List<Object> reply =
          redisson.getScript(StringCodec.INSTANCE).eval(
              RScript.Mode.READ_WRITE,
              RECOVER_SCRIPT,
              RScript.ReturnType.MULTI,
              List.<Object>of(
                  RedisKeys.active(queue),
                  RedisKeys.waiting(queue),
                  RedisKeys.jobs(queue),
                  RedisKeys.dead(queue)),
              String.valueOf(now.toEpochMilli()),
              STALLED_ERROR);
      if (reply == null || reply.isEmpty()) {
        return StallRecovery.none();
      }
      int requeued = Integer.parseInt(String.valueOf(reply.get(0)));
      List<StoredJob> exhausted = new ArrayList<>();
      for (Object json : reply.subList(1, reply.size())) {
        exhausted.add(Jsons.fromJson(String.valueOf(json), StoredJob.class));
      }
      return new StallRecovery(requeued, exhausted);
    });
  }

  @Override
  public boolean tryAcquireRate(QueueName queue, long permitsPerSecond) {
    long rate = Math.max(1, permitsPerSecond);
    return call("acquire rate permit on " + queue, () -> {
      RateSlot slot = limiters.compute(queue, (q, existing) -> {
        if (existing != null && existing.permitsPerSecond() == rate) {
          return existing;
        }
        RRateLimiter limiter = redisson.getRateLimiter(RedisKeys.rateLimiter(q));
        if (!limiter.trySetRate(RateType.OVERALL, rate, 1, RateIntervalUnit.SECONDS)) {
          limiter.setRate(RateType.OVERALL, rate, 1, RateIntervalUnit.SECONDS);
        }
        return new RateSlot(limiter, rate);
      });
      return slot.limiter().tryAcquire();
    });
  }

  @Override
  public Optional<StoredJob> find(QueueName queue, String jobId) {
    return call("find job " + jobId, () -> {
      String json =
          redisson.<String, String>getMap(RedisKeys.jobs(queue), StringCodec.INSTANCE).get(jobId);
      return Optional.ofNullable(json).map(j -> Jsons.fromJson(j, StoredJob.class));
    });
  }

  @Override
  public long count(QueueName queue, JobState state) {
    String key = switch (state) {
      case WAITING -> RedisKeys.waiting(queue);
      case ACTIVE -> RedisKeys.active(queue);
      case DEAD -> RedisKeys.dead(queue);
    };
    return call("count " + state + " on " + queue,
        () -> (long) redisson.getScoredSortedSet(key, StringCodec.INSTANCE).size());
  }

  @Override
  public void close() {
    limiters.clear();
    LOG.info("Redis job store closed");
  }

  private RBatch atomicBatch() {
    return redisson.createBatch(
        BatchOptions.defaults().executionMode(BatchOptions.ExecutionMode.IN_MEMORY_ATOMIC));
  }

  private <T> T call(String operation, Supplier<T> action) {
    try {
      return action.get();
    } catch (RedisException e) {
      LOG.warn("Redis operation failed: {}: {}", operation, e.getMessage());
      throw new TransientException("Redis error during " + operation + ": " + e.getMessage(), e);
    }
  }
}
