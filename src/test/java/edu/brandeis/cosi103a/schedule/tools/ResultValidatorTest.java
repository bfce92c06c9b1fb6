package edu.brandeis.cosi103a.schedule.tools;

import edu.brandeis.cosi103a.schedule.model.SchedulePath;
import edu.brandeis.cosi103a.schedule.model.WeekSchedule;
import edu.brandeis.cosi103a.schedule.tree.TreeWriter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResultValidatorTest {

    private static final WeekSchedule W0 = WeekSchedule.of(0, 1, 5, 2, 7, 11, 12, 13, 14);
    private static final WeekSchedule W1 = WeekSchedule.of(0, 4, 8, 3, 6, 11, 12, 10, 9);
    // Legal week scoring (3,4)
    private static final WeekSchedule WORSE = WeekSchedule.of(0, 1, 5, 2, 7, 11, 13, 12, 14);

    @Test
    void validate_cleanFile(@TempDir Path dir) throws Exception {
        Path file = write(dir, List.of(SchedulePath.of(W0, W1)));

        ValidationReport report = new ResultValidator().validate(file);

        assertTrue(report.isClean(), report.problems().toString());
        assertEquals(1, report.checked());
    }

    @Test
    void validate_reportsBrokenRoundsWorseWeeksAndDuplicates(@TempDir Path dir) throws Exception {
        Path file = write(dir, List.of(
            SchedulePath.of(W0, W1),
            SchedulePath.of(W0, W0),
            SchedulePath.of(WORSE, W1),
            SchedulePath.of(W0, W1)));

        ValidationReport report = new ResultValidator().validate(file);

        assertFalse(report.isClean());
        assertEquals(4, report.checked());
        assertEquals(2, report.invalid());
        assertEquals(1, report.duplicates());
        assertTrue(report.problems().get(0).startsWith("Path 2: "));
        assertTrue(report.problems().get(1).contains("scores (3,4)"));
        assertTrue(report.problems().get(2).contains("duplicate"));
    }

    private static Path write(Path dir, List<SchedulePath> paths) throws Exception {
        Path file = dir.resolve("6teams-2weeks.txt");
        try (TreeWriter writer = TreeWriter.create(file, 6, 2)) {
            for (SchedulePath path : paths) {
                writer.writePath(path);
            }
            writer.finish(false);
        }
        return file;
    }
}
