package com.eli.beamline.shotlog.notify;

import com.eli.beamline.shotlog.domain.ClosedShot;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Any;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Fans a closed shot out to every registered {@link ShotClosureListener}.
 * A failing listener is logged and does not stop the others.
 */
@ApplicationScoped
public class ShotClosureNotifier {

    private static final Logger LOG = Logger.getLogger(ShotClosureNotifier.class);

    private final Iterable<ShotClosureListener> listeners;

    @Inject
    public ShotClosureNotifier(@Any Instance<ShotClosureListener> listeners) {
        this.listeners = listeners;
    }

    public ShotClosureNotifier(Iterable<ShotClosureListener> listeners) {
        this.listeners = listeners;
    }

    public void notifyClosed(ClosedShot shot) {
        for (ShotClosureListener listener : listeners) {
            try {
                listener.onShotClosed(shot);
            } catch (RuntimeException e) {
                LOG.errorf(e, "Closure listener %s failed for shot %03d (%s)",
                        listener.getClass().getSimpleName(), shot.shotNumber(), shot.date());
            }
        }
    }
}
