package com.eli.beamline.shotlog.notify;

import com.eli.beamline.shotlog.domain.ArchiveResult;
import com.eli.beamline.shotlog.domain.ClosedShot;
import com.eli.beamline.shotlog.domain.FileEvent;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.Optional;

/**
 * Writes the shot log: outcome line plus a timing summary of the accepted images.
 */
@ApplicationScoped
public class LoggingShotClosureListener implements ShotClosureListener {

    private static final Logger LOG = Logger.getLogger(LoggingShotClosureListener.class);

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    @Override
    public void onShotClosed(ClosedShot shot) {
        if (shot.isComplete()) {
            LOG.infof("Shot %03d (%s) acquired successfully (%s), all cameras present: %s",
                    shot.shotNumber(), shot.date(), shot.reason(), shot.imagesByCamera().keySet());
        } else {
            LOG.warnf("Shot %03d (%s) acquired (%s), missing cameras: %s",
                    shot.shotNumber(), shot.date(), shot.reason(), shot.missingCameras());
        }
        LOG.info(timingSummary(shot));

        for (ArchiveResult result : shot.archiveResults()) {
            if (result.status() == ArchiveResult.Status.FAILED) {
                LOG.errorf("Shot %03d: image of %s was not archived after %d attempt(s): %s",
                        shot.shotNumber(), result.camera(), result.attempts(), result.errorMessage());
            }
        }
    }

    static String timingSummary(ClosedShot shot) {
        Optional<FileEvent> first = shot.imagesByCamera().values().stream()
                .min(Comparator.comparing(FileEvent::dt));
        Optional<FileEvent> last = shot.imagesByCamera().values().stream()
                .max(Comparator.comparing(FileEvent::dt));

        return String.format("Shot %03d (%s) timing: trigger_cam=%s, trigger_time=%s, "
                        + "min_mtime=%s, max_mtime=%s, first_camera=%s, last_camera=%s",
                shot.shotNumber(), shot.date(), shot.triggerCamera(), format(shot.triggerTime()),
                first.map(e -> format(e.dt())).orElse("N/A"),
                last.map(e -> format(e.dt())).orElse("N/A"),
                first.map(FileEvent::camera).orElse("N/A"),
                last.map(FileEvent::camera).orElse("N/A"));
    }

    private static String format(LocalDateTime dt) {
        return dt != null ? TIMESTAMP.format(dt) : "N/A";
    }
}
