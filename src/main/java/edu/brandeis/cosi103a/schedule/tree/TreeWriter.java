package edu.brandeis.cosi103a.schedule.tree;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import edu.brandeis.cosi103a.schedule.model.SchedulePath;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Streams paths into a result file, writing only the weeks that differ from the previous
 * path. The file starts out flagged partial; {@link #finish(boolean)} rewrites the count
 * field of the header in place.
 *
 * <p>Only one thread may use a writer.
 */
public class TreeWriter implements Closeable {

    private final Path file;
    private final TreeHeader header;
    private final BufferedWriter out;
    private SchedulePath previous = SchedulePath.empty();
    private long count;
    private boolean closed;

    private TreeWriter(Path file, TreeHeader header, BufferedWriter out) {
        this.file = file;
        this.header = header;
        this.out = out;
    }

    /** Creates or truncates {@code file} and writes a partial header. */
    public static TreeWriter create(Path file, int teams, int weeks) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        TreeHeader header = new TreeHeader(teams, weeks, 0, true);
        BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
        out.write(header.format());
        out.newLine();
        return new TreeWriter(file, header, out);
    }

    public Path file() {
        return file;
    }

    public TreeHeader header() {
        return header;
    }

    /** Full-length paths written so far. */
    public long count() {
        return count;
    }

    public SchedulePath previousPath() {
        return previous;
    }

    /**
     * Writes a full-length path.
     *
     * @throws IllegalArgumentException if the path does not have the header's week count
     */
    public void writePath(SchedulePath path) throws IOException {
        Preconditions.checkArgument(path.size() == header.weeks(),
            "Path has %s weeks, file holds %s", path.size(), header.weeks());
        // A repeated path still needs its last line.
        writeSuffix(path, Math.min(previous.commonPrefixLength(path), path.size() - 1));
        previous = path;
        count++;
    }

    /**
     * Writes {@code marker} for the branch {@code prefix}, one level below its last week.
     */
    public void writeMarker(SchedulePath prefix, BranchMarker marker) throws IOException {
        Preconditions.checkArgument(!prefix.isEmpty() && prefix.size() < header.weeks(),
            "Marker prefix must have 1 to %s weeks, got %s", header.weeks() - 1, prefix.size());
        writeSuffix(prefix, previous.commonPrefixLength(prefix));
        out.write(Strings.repeat("\t", prefix.size()));
        out.write(marker.symbol());
        out.newLine();
        previous = prefix;
    }

    public void flush() throws IOException {
        out.flush();
    }

    /**
     * Closes the body and rewrites the header with the final count.
     *
     * @param partial keep the partial flag
     */
    public void finish(boolean partial) throws IOException {
        if (closed) {
            return;
        }
        close();
        TreeHeader done = header.withCount(count, partial);
        byte[] field = done.countField().getBytes(StandardCharsets.UTF_8);
        int offset = done.prefix().getBytes(StandardCharsets.UTF_8).length;
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.WRITE)) {
            ByteBuffer buffer = ByteBuffer.wrap(field);
            long position = offset;
            while (buffer.hasRemaining()) {
                position += channel.write(buffer, position);
            }
        }
    }

    /** Closes without touching the header, leaving the file flagged partial. */
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        out.close();
    }

    private void writeSuffix(SchedulePath path, int common) throws IOException {
        for (int depth = common; depth < path.size(); depth++) {
            out.write(Strings.repeat("\t", depth));
            out.write(path.week(depth).toLine());
            out.newLine();
        }
    }
}
