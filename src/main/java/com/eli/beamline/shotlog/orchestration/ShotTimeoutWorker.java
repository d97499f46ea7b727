package com.eli.beamline.shotlog.orchestration;

import com.eli.beamline.shotlog.domain.ClosedShot;
import com.eli.beamline.shotlog.service.ShotLogService;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * Periodically closes shots whose collection time ran out.
 * Skips its pass while the service is paused, stopped, or the correlator is shut down.
 */
@ApplicationScoped
public class ShotTimeoutWorker {

    private static final Logger LOG = Logger.getLogger(ShotTimeoutWorker.class);

    private final ShotCorrelator correlator;
    private final ShotLogService service;

    public ShotTimeoutWorker(ShotCorrelator correlator, ShotLogService service) {
        this.correlator = correlator;
        this.service = service;
    }

    @Scheduled(every = "${shotlog.check-interval:0.5s}",
            identity = "shot-timeout-worker",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void scheduledScan() {
        scan();
    }

    /**
     * One pass over the open shots.
     *
     * @return number of shots closed by this pass
     */
    public int scan() {
        if (correlator.isShutdown() || !service.isActive()) {
            return 0;
        }
        try {
            List<ClosedShot> closed = correlator.closeTimedOutShots();
            if (!closed.isEmpty()) {
                LOG.debugf("Timeout pass closed %d shot(s)", closed.size());
            }
            return closed.size();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Exception in timeout worker");
            service.markError();
            return 0;
        }
    }
}
