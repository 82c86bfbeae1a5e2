package com.promptqueue.store;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.promptqueue.core.InvalidTransitionException;
import com.promptqueue.core.Job;
import com.promptqueue.core.JobStatus;
import com.promptqueue.core.QueueState;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * File-system repository for job records and the queue state record.
 *
 * <p>Each job is one UTF-8 file. The directory a file sits in, together with its name
 * suffix, is the job's status:</p>
 * <pre>
 * &lt;storage&gt;/
 *   queue/       &lt;id&gt;-&lt;slug&gt;.md           QUEUED
 *                &lt;id&gt;-&lt;slug&gt;.executing.md EXECUTING
 *   completed/   &lt;id&gt;-&lt;slug&gt;.md           COMPLETED
 *   failed/      &lt;id&gt;-&lt;slug&gt;.md           FAILED
 *                &lt;id&gt;-&lt;slug&gt;.cancelled.md CANCELLED
 *   quarantine/  records that could not be parsed
 *   .tmp/        writes in progress
 *   queue-state.json
 * </pre>
 *
 * <p><b>Atomicity:</b> every write goes to {@code .tmp/}, is forced to disk and then
 * renamed over its destination. A status change is two renames: the new content replaces
 * the current file in place, then the file is renamed into its target bucket. The second
 * rename is the commit point. Status is always derived from the location on load, so a
 * crash between the two steps leaves the job in its old status.</p>
 *
 * <p><b>Thread Safety:</b> not thread-safe. The storage directory has a single writer.</p>
 *
 * @see JobRecordCodec
 */
public class JobStore {
    private static final Logger logger = Logger.getLogger(JobStore.class.getName());

    static final String QUEUE_DIR = "queue";
    static final String COMPLETED_DIR = "completed";
    static final String FAILED_DIR = "failed";
    static final String QUARANTINE_DIR = "quarantine";
    static final String TMP_DIR = ".tmp";
    static final String STATE_FILE = "queue-state.json";

    private static final String RECORD_SUFFIX = ".md";
    private static final String EXECUTING_SUFFIX = ".executing.md";
    private static final String CANCELLED_SUFFIX = ".cancelled.md";
    private static final int MAX_SLUG_LENGTH = 40;
    private static final Pattern VALID_ID = Pattern.compile("[A-Za-z0-9_]+");

    /**
     * The durable groupings a record can live in.
     */
    public enum Bucket {
        PENDING(QUEUE_DIR),
        COMPLETED(COMPLETED_DIR),
        FAILED(FAILED_DIR);

        private final String directoryName;

        Bucket(String directoryName) {
            this.directoryName = directoryName;
        }

        public String getDirectoryName() {
            return directoryName;
        }

        public static Bucket of(JobStatus status) {
            return switch (status) {
                case QUEUED, EXECUTING -> PENDING;
                case COMPLETED -> COMPLETED;
                case FAILED, CANCELLED -> FAILED;
            };
        }
    }

    private final Path baseDir;
    private final JobRecordCodec codec = new JobRecordCodec();
    private final Gson stateGson = new GsonBuilder()
            .registerTypeAdapter(LocalDateTime.class, new LocalDateTimeAdapter())
            .setPrettyPrinting()
            .create();

    private JobStore(Path baseDir) {
        this.baseDir = baseDir;
    }

    /**
     * Open a store rooted at an existing, writable directory.
     *
     * <p>Creates the bucket directories when missing.</p>
     *
     * @param baseDir the storage directory
     * @return the opened store
     * @throws StorageUnavailableException if the directory is missing, not a directory,
     *         not writable, or its layout cannot be created
     */
    public static JobStore open(Path baseDir) {
        Path dir = baseDir.toAbsolutePath().normalize();
        if (!Files.exists(dir)) {
            throw new StorageUnavailableException("Storage directory does not exist", dir);
        }
        if (!Files.isDirectory(dir)) {
            throw new StorageUnavailableException("Storage location is not a directory", dir);
        }
        if (!Files.isWritable(dir)) {
            throw new StorageUnavailableException("Storage directory is not writable", dir);
        }

        try {
            for (String name : List.of(QUEUE_DIR, COMPLETED_DIR, FAILED_DIR, QUARANTINE_DIR, TMP_DIR)) {
                Files.createDirectories(dir.resolve(name));
            }
        } catch (IOException e) {
            throw new StorageUnavailableException("Cannot initialize storage layout", dir, e);
        }
        logger.info("Job store opened at " + dir);
        return new JobStore(dir);
    }

    public Path getBaseDir() {
        return baseDir;
    }

    // ==================== JOB RECORDS ====================

    /**
     * Persist a new job in the pending bucket.
     *
     * <p>Assigns a fresh id that no record in any bucket uses, sets the creation time when
     * missing and forces the status to QUEUED.</p>
     *
     * @param job the job to store; its id is overwritten
     * @param now the creation time to use when the job has none
     * @return the stored job
     * @throws IOException if the record cannot be written
     */
    public Job create(Job job, LocalDateTime now) throws IOException {
        String id = freshId();
        job.setId(id);
        if (job.getCreatedAt() == null) {
            job.setCreatedAt(now);
        }
        job.setStatus(JobStatus.QUEUED);

        Path target = dir(QUEUE_DIR).resolve(baseName(id, job.getContent()) + RECORD_SUFFIX);
        writeAtomically(target, codec.encode(job));
        logger.info("Created job " + id + " (priority " + job.getPriority() + ")");
        return job;
    }

    /**
     * Move a prompt file from outside the storage directory into the queue.
     *
     * <p>The file may be a plain Markdown prompt or carry a header; header fields that are
     * present (priority, working directory, model and so on) are kept. The job gets a fresh
     * id and the original file is removed once the record is written.</p>
     *
     * @param source the prompt file
     * @param now the creation time to use when the header has none
     * @return the stored job
     * @throws CorruptRecordException if the file is not a usable prompt
     * @throws IOException if the file cannot be read, written or removed
     */
    public Job importFile(Path source, LocalDateTime now) throws IOException {
        String text = Files.readString(source, StandardCharsets.UTF_8);
        Job job = codec.decodeDraft(text, now);
        create(job, now);
        Files.delete(source);
        logger.info("Imported " + source.getFileName() + " as job " + job.getId());
        return job;
    }

    /**
     * Find a job by id in any bucket.
     *
     * @param id the job id
     * @return the job, or empty if no readable record exists
     * @throws IOException if the storage cannot be read
     */
    public Optional<Job> findById(String id) throws IOException {
        Optional<Path> path = pathOf(id);
        if (path.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(read(path.get()));
    }

    /**
     * Locate the file currently holding a job.
     *
     * @param id the job id
     * @return the path, or empty if the id is unknown
     * @throws IOException if the storage cannot be read
     */
    public Optional<Path> pathOf(String id) throws IOException {
        for (String bucket : List.of(QUEUE_DIR, COMPLETED_DIR, FAILED_DIR)) {
            for (Path file : recordFiles(dir(bucket))) {
                if (id.equals(idOf(file))) {
                    return Optional.of(file);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Load every record in the pending bucket (QUEUED and EXECUTING).
     */
    public List<Job> loadPending() throws IOException {
        return listBucket(Bucket.PENDING);
    }

    /**
     * Load every record in every bucket.
     */
    public List<Job> loadAll() throws IOException {
        List<Job> jobs = new ArrayList<>();
        for (Bucket bucket : Bucket.values()) {
            jobs.addAll(listBucket(bucket));
        }
        return jobs;
    }

    /**
     * Load the records of one bucket in file-name order. Corrupt records are quarantined
     * and skipped.
     *
     * @param bucket the bucket to read
     * @return the readable jobs, each carrying the status implied by its location
     * @throws IOException if the bucket directory cannot be listed
     */
    public List<Job> listBucket(Bucket bucket) throws IOException {
        List<Job> jobs = new ArrayList<>();
        for (Path file : recordFiles(dir(bucket.getDirectoryName()))) {
            Job job = read(file);
            if (job != null) {
                jobs.add(job);
            }
        }
        return jobs;
    }

    /**
     * Rewrite a job's record in place. Used for updates that keep the job in its bucket.
     *
     * @param job the job with updated fields
     * @throws NoSuchFileException if the record no longer exists
     * @throws IOException if the write fails
     */
    public void rewrite(Job job) throws IOException {
        Path current = requirePath(job.getId());
        writeAtomically(current, codec.encode(job));
    }

    /**
     * Commit a status change.
     *
     * <p>The legality of the edge is checked against the status implied by the record's
     * current location, not against the in-memory job. On success the job's status field
     * is set to {@code target} and its full content is persisted with it.</p>
     *
     * @param job the job, carrying any field updates that go with the transition
     * @param target the new status
     * @return the path of the record after the move
     * @throws InvalidTransitionException if the edge is not allowed
     * @throws NoSuchFileException if the record no longer exists
     * @throws IOException if a write or move fails
     */
    public Path transition(Job job, JobStatus target) throws IOException {
        Path current = requirePath(job.getId());
        JobStatus from = statusOf(current);
        if (!from.canTransitionTo(target)) {
            throw new InvalidTransitionException(job.getId(), from, target);
        }

        job.setStatus(target);
        writeAtomically(current, codec.encode(job));

        Path destination = dir(Bucket.of(target).getDirectoryName())
                .resolve(baseNameOf(current) + suffixFor(target));
        Files.move(current, destination, StandardCopyOption.ATOMIC_MOVE);
        logger.fine("Job " + job.getId() + ": " + from + " -> " + target);
        return destination;
    }

    /**
     * Remove a record permanently.
     *
     * @param id the job id
     * @return true if a record was deleted
     * @throws IOException if the file cannot be removed
     */
    public boolean delete(String id) throws IOException {
        Optional<Path> path = pathOf(id);
        if (path.isEmpty()) {
            return false;
        }
        Files.delete(path.get());
        logger.info("Deleted job " + id);
        return true;
    }

    /**
     * Status implied by the location of a record file.
     */
    public JobStatus statusOf(Path file) {
        String bucket = file.getParent().getFileName().toString();
        String name = file.getFileName().toString();
        switch (bucket) {
            case QUEUE_DIR:
                return name.endsWith(EXECUTING_SUFFIX) ? JobStatus.EXECUTING : JobStatus.QUEUED;
            case COMPLETED_DIR:
                return JobStatus.COMPLETED;
            case FAILED_DIR:
                return name.endsWith(CANCELLED_SUFFIX) ? JobStatus.CANCELLED : JobStatus.FAILED;
            default:
                throw new IllegalArgumentException("Not a record location: " + file);
        }
    }

    /**
     * Put every record left EXECUTING by an earlier process back to QUEUED and remove
     * leftovers of interrupted writes from {@code .tmp/}.
     *
     * <p>Only the status changes; counters, timestamps and the log are kept as they are.</p>
     *
     * @return number of jobs recovered
     * @throws IOException if the pending bucket cannot be listed
     */
    public int recoverInterrupted() throws IOException {
        cleanTempDir();
        int recovered = 0;
        for (Path file : recordFiles(dir(QUEUE_DIR))) {
            if (!file.getFileName().toString().endsWith(EXECUTING_SUFFIX)) {
                continue;
            }
            Job job = read(file);
            if (job == null) {
                continue;
            }
            transition(job, JobStatus.QUEUED);
            logger.info("Recovered interrupted job " + job.getId());
            recovered++;
        }
        return recovered;
    }

    // ==================== QUEUE STATE ====================

    /**
     * Load the queue state record. A missing record yields a fresh state; a corrupt one
     * is quarantined and replaced by a fresh state.
     *
     * @return the state
     * @throws IOException if the file exists but cannot be read
     */
    public QueueState loadState() throws IOException {
        Path file = baseDir.resolve(STATE_FILE);
        if (!Files.exists(file)) {
            return new QueueState();
        }
        String json = Files.readString(file, StandardCharsets.UTF_8);
        try {
            QueueState state = stateGson.fromJson(json, QueueState.class);
            if (state == null) {
                throw new JsonParseException("empty state record");
            }
            return state;
        } catch (JsonParseException e) {
            logger.warning("Queue state is corrupt, starting from a fresh state: " + e.getMessage());
            quarantine(file);
            return new QueueState();
        }
    }

    /**
     * Persist the queue state record atomically.
     */
    public void saveState(QueueState state) throws IOException {
        writeAtomically(baseDir.resolve(STATE_FILE), stateGson.toJson(state));
    }

    // ==================== INTERNALS ====================

    private Job read(Path file) throws IOException {
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return null;
        }
        if (isAdoptable(file) && codec.isDraft(text)) {
            return adopt(file, text);
        }
        try {
            Job job = codec.decode(text);
            if (!job.getId().equals(idOf(file))) {
                throw new CorruptRecordException("Header id " + job.getId() + " does not match file name");
            }
            job.setStatus(statusOf(file));
            return job;
        } catch (CorruptRecordException e) {
            logger.warning("Quarantining corrupt record " + file.getFileName() + ": " + e.getMessage());
            quarantine(file);
            return null;
        }
    }

    // hand-written prompts are only picked up where a queued record would live
    private boolean isAdoptable(Path file) {
        return file.getParent().getFileName().toString().equals(QUEUE_DIR)
                && !file.getFileName().toString().endsWith(EXECUTING_SUFFIX);
    }

    private Job adopt(Path file, String text) throws IOException {
        LocalDateTime modified = LocalDateTime.ofInstant(
                Files.getLastModifiedTime(file).toInstant(), ZoneId.systemDefault());
        Job job;
        try {
            job = codec.decodeDraft(text, modified);
        } catch (CorruptRecordException e) {
            logger.warning("Quarantining unreadable prompt " + file.getFileName() + ": " + e.getMessage());
            quarantine(file);
            return null;
        }

        String id = idOf(file);
        Path target = file;
        if (!VALID_ID.matcher(id).matches() || idTakenElsewhere(id, file)) {
            id = freshId();
            target = dir(QUEUE_DIR).resolve(baseName(id, job.getContent()) + RECORD_SUFFIX);
        }
        job.setId(id);
        writeAtomically(target, codec.encode(job));
        if (!target.equals(file)) {
            Files.delete(file);
        }
        logger.info("Adopted hand-written prompt " + file.getFileName() + " as job " + id);
        return job;
    }

    private boolean idTakenElsewhere(String id, Path file) throws IOException {
        for (String bucket : List.of(QUEUE_DIR, COMPLETED_DIR, FAILED_DIR, QUARANTINE_DIR)) {
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir(bucket))) {
                for (Path other : stream) {
                    if (!other.equals(file) && id.equals(idOf(other))) {
                        return true;
                    }
                }
            }
        }
        return false;
    }

    private String freshId() throws IOException {
        Set<String> taken = allIds();
        String id = Job.newId();
        while (taken.contains(id)) {
            logger.fine("Id collision on " + id + ", generating another");
            id = Job.newId();
        }
        return id;
    }

    private Path requirePath(String id) throws IOException {
        return pathOf(id).orElseThrow(() -> new NoSuchFileException("No record for job " + id));
    }

    private void quarantine(Path file) throws IOException {
        Path target = dir(QUARANTINE_DIR).resolve(file.getFileName().toString());
        if (Files.exists(target)) {
            target = dir(QUARANTINE_DIR).resolve(file.getFileName() + "." + System.currentTimeMillis());
        }
        Files.move(file, target, StandardCopyOption.ATOMIC_MOVE);
    }

    private void writeAtomically(Path target, String content) throws IOException {
        Path temp = Files.createTempFile(dir(TMP_DIR), "write-", ".tmp");
        try {
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE,
                    StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(content.getBytes(StandardCharsets.UTF_8));
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }

    private void cleanTempDir() throws IOException {
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir(TMP_DIR))) {
            for (Path leftover : stream) {
                Files.deleteIfExists(leftover);
                logger.info("Removed incomplete write " + leftover.getFileName());
            }
        }
    }

    private Set<String> allIds() throws IOException {
        Set<String> ids = new HashSet<>();
        for (String bucket : List.of(QUEUE_DIR, COMPLETED_DIR, FAILED_DIR, QUARANTINE_DIR)) {
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir(bucket))) {
                for (Path file : stream) {
                    ids.add(idOf(file));
                }
            }
        }
        return ids;
    }

    private List<Path> recordFiles(Path directory) throws IOException {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + RECORD_SUFFIX)) {
            for (Path file : stream) {
                if (Files.isRegularFile(file)) {
                    files.add(file);
                }
            }
        }
        files.sort(Comparator.comparing(p -> p.getFileName().toString()));
        return files;
    }

    private Path dir(String name) {
        return baseDir.resolve(name);
    }

    private static String suffixFor(JobStatus status) {
        return switch (status) {
            case EXECUTING -> EXECUTING_SUFFIX;
            case CANCELLED -> CANCELLED_SUFFIX;
            default -> RECORD_SUFFIX;
        };
    }

    // "<id>-<slug>" from a record file name, without any status suffix
    static String baseNameOf(Path file) {
        String name = file.getFileName().toString();
        for (String suffix : List.of(EXECUTING_SUFFIX, CANCELLED_SUFFIX, RECORD_SUFFIX)) {
            if (name.endsWith(suffix)) {
                return name.substring(0, name.length() - suffix.length());
            }
        }
        return name;
    }

    static String idOf(Path file) {
        String name = file.getFileName().toString();
        int end = 0;
        while (end < name.length() && name.charAt(end) != '-' && name.charAt(end) != '.') {
            end++;
        }
        return name.substring(0, end);
    }

    static String baseName(String id, String content) {
        String slug = content.strip().toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("^-+", "");
        if (slug.length() > MAX_SLUG_LENGTH) {
            slug = slug.substring(0, MAX_SLUG_LENGTH);
        }
        slug = slug.replaceAll("-+$", "");
        return slug.isEmpty() ? id + "-prompt" : id + "-" + slug;
    }
}
