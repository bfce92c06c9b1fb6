package edu.brandeis.cosi103a.schedule.runner;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ResultFilesTest {

    @Test
    void resultFile_namesSeedAndMultiWeekFiles(@TempDir Path dir) {
        ResultFiles files = new ResultFiles(dir, 10);
        assertEquals(dir.resolve("10teams-1week.txt"), files.resultFile(1));
        assertEquals(dir.resolve("10teams-12weeks.txt"), files.resultFile(12));
    }

    @Test
    void summaryAndTemporaryFiles_sitNextToTarget(@TempDir Path dir) {
        Path target = dir.resolve("8teams-3weeks.txt");
        assertEquals(dir.resolve("8teams-3weeks.json"), ResultFiles.summaryFile(target));
        assertEquals(dir.resolve("8teams-3weeks.txt.tmp"), ResultFiles.temporaryFile(target));
    }

    @Test
    void bestPrior_picksLongestCompleteFile(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("6teams-1week.txt"), "# teams=6 weeks=1 count=0\n");
        Files.writeString(dir.resolve("6teams-2weeks.txt"), "# teams=6 weeks=2 count=0\n");
        Files.writeString(dir.resolve("6teams-3weeks.txt"), "# teams=6 weeks=3 count=0 (partial)\n");

        Optional<ResultFiles.Prior> prior = new ResultFiles(dir, 6).bestPrior(5);

        assertTrue(prior.isPresent());
        assertEquals(2, prior.get().weeks());
        assertEquals(dir.resolve("6teams-2weeks.txt"), prior.get().file());
    }

    @Test
    void bestPrior_skipsBrokenAndMismatchedFiles(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("6teams-1week.txt"), "garbage\n");
        Files.writeString(dir.resolve("6teams-2weeks.txt"), "# teams=6 weeks=5 count=0\n");

        assertEquals(Optional.empty(), new ResultFiles(dir, 6).bestPrior(3));
    }
}
