package binoculars.ext.sixs.jobs;

import binoculars.ext.sixs.model.Job;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Stores generated jobs as a JSON file so an external dispatcher can hand them to workers.
 *
 * <pre>
 * [
 *   {"scan": 42, "firstPoint": 0, "lastPoint": 29, "weight": 30},
 *   ...
 * ]
 * </pre>
 */
public class JobManifest {
    private static final Logger logger = LoggerFactory.getLogger(JobManifest.class);

    private static final Type JOB_LIST = new TypeToken<List<Job>>() {}.getType();

    private final Gson gson;

    public JobManifest() {
        this.gson = new GsonBuilder()
                .registerTypeAdapter(Job.class, new JobAdapter())
                .setPrettyPrinting()
                .create();
    }

    public String toJson(List<Job> jobs) {
        return gson.toJson(jobs, JOB_LIST);
    }

    /**
     * @throws JsonParseException if the text is not a job list
     */
    public List<Job> fromJson(String json) {
        List<Job> jobs = gson.fromJson(json, JOB_LIST);
        return jobs == null ? new ArrayList<>() : jobs;
    }

    public void write(Path file, List<Job> jobs) throws IOException {
        Files.writeString(file, toJson(jobs));
        logger.info("Saved {} jobs to {}", jobs.size(), file);
    }

    /**
     * @throws IOException if the file cannot be read or does not hold a job list
     */
    public List<Job> read(Path file) throws IOException {
        try {
            List<Job> jobs = fromJson(Files.readString(file));
            logger.info("Loaded {} jobs from {}", jobs.size(), file);
            return jobs;
        } catch (JsonParseException e) {
            throw new IOException("Invalid job manifest " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Writes jobs field by field and validates them again on reading.
     */
    private static class JobAdapter extends TypeAdapter<Job> {

        @Override
        public void write(JsonWriter out, Job job) throws IOException {
            if (job == null) {
                out.nullValue();
                return;
            }
            out.beginObject();
            out.name("scan").value(job.scan());
            out.name("firstPoint").value(job.firstPoint());
            out.name("lastPoint").value(job.lastPoint());
            out.name("weight").value(job.weight());
            out.endObject();
        }

        @Override
        public Job read(JsonReader in) throws IOException {
            if (in.peek() == JsonToken.NULL) {
                in.nextNull();
                return null;
            }
            Integer scan = null;
            Integer firstPoint = null;
            Integer lastPoint = null;
            Integer weight = null;

            in.beginObject();
            while (in.hasNext()) {
                String name = in.nextName();
                switch (name) {
                    case "scan" -> scan = in.nextInt();
                    case "firstPoint" -> firstPoint = in.nextInt();
                    case "lastPoint" -> lastPoint = in.nextInt();
                    case "weight" -> weight = in.nextInt();
                    default -> in.skipValue();
                }
            }
            in.endObject();

            if (scan == null || firstPoint == null || lastPoint == null || weight == null) {
                throw new JsonParseException("Job entry needs scan, firstPoint, lastPoint and weight");
            }
            try {
                return new Job(scan, firstPoint, lastPoint, weight);
            } catch (IllegalArgumentException e) {
                throw new JsonParseException(e.getMessage(), e);
            }
        }
    }
}
