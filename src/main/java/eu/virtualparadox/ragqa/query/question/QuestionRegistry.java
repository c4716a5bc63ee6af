package eu.virtualparadox.ragqa.query.question;

import eu.virtualparadox.ragqa.query.QueryRequest;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

@Service
public class QuestionRegistry {

    private final AtomicLong counter;
    private final Map<Long, QuestionJob> jobs;

    public QuestionRegistry() {
        this.counter = new AtomicLong(0);
        this.jobs = new ConcurrentHashMap<>();
    }

    public QuestionJob createJob(final QueryRequest request) {
        final long id = counter.incrementAndGet();
        final QuestionJob job = new QuestionJob(id, request);
        jobs.put(id, job);
        return job;
    }

    public Optional<QuestionJob> getJob(final long id) {
        return Optional.ofNullable(jobs.get(id));
    }

    /**
     * Drops a finished job; running jobs stay registered.
     *
     * @return {@code true} if the job was removed
     */
    public boolean remove(final long id) {
        final QuestionJob job = jobs.get(id);
        return job != null && job.getStatus().isTerminal() && jobs.remove(id, job);
    }
}
