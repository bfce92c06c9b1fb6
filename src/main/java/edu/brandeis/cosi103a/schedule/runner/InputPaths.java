package edu.brandeis.cosi103a.schedule.runner;

import edu.brandeis.cosi103a.schedule.model.SchedulePath;
import edu.brandeis.cosi103a.schedule.tree.TreeReader;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;

/**
 * Input paths of a run, re-read from the start for every fairness round. File-backed
 * sources are streamed; only validate runs keep their inputs in memory.
 */
interface InputPaths {

    Cursor open() throws IOException;

    /** Where the paths come from, for messages. */
    String describe();

    interface Cursor extends Closeable {
        /** Next path, or {@code null} when done. */
        SchedulePath next() throws IOException;
    }

    static InputPaths of(Path file) {
        return new InputPaths() {
            @Override
            public Cursor open() throws IOException {
                TreeReader reader = TreeReader.open(file);
                return new Cursor() {
                    @Override
                    public SchedulePath next() throws IOException {
                        return reader.nextPath();
                    }

                    @Override
                    public void close() throws IOException {
                        reader.close();
                    }
                };
            }

            @Override
            public String describe() {
                return file.toString();
            }
        };
    }

    static InputPaths of(List<SchedulePath> paths) {
        return new InputPaths() {
            @Override
            public Cursor open() {
                Iterator<SchedulePath> it = paths.iterator();
                return new Cursor() {
                    @Override
                    public SchedulePath next() {
                        return it.hasNext() ? it.next() : null;
                    }

                    @Override
                    public void close() {
                    }
                };
            }

            @Override
            public String describe() {
                return paths.size() + " generated week-0 schedules";
            }
        };
    }
}
