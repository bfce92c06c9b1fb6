package edu.brandeis.cosi103a.schedule.tree;

import edu.brandeis.cosi103a.schedule.model.SchedulePath;
import edu.brandeis.cosi103a.schedule.model.WeekSchedule;

/**
 * One body line as seen by {@link TreeReader}: either a week or a marker.
 *
 * @param depth  indentation, equal to the week index of the line
 * @param week   the week on this line, {@code null} for markers
 * @param marker the marker on this line, {@code null} for weeks
 * @param path   for a week, the path ending with it; for a marker, the branch it marks
 */
public record TreeLine(int depth, WeekSchedule week, BranchMarker marker, SchedulePath path) {

    public boolean isMarker() {
        return marker != null;
    }
}
