package com.yoursp.emailconnections.modules.monitor;

import com.yoursp.emailconnections.config.EmailConnectionProperties;
import com.yoursp.emailconnections.exception.ConnectionException;
import com.yoursp.emailconnections.model.ConnectionStatus;
import com.yoursp.emailconnections.model.entity.EmailConnection;
import com.yoursp.emailconnections.modules.connections.ConnectionTokenService;
import com.yoursp.emailconnections.modules.monitor.dto.MonitorStatus;
import com.yoursp.emailconnections.repository.EmailConnectionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Background maintenance of email connections.
 * <ul>
 * <li>Quick check: stale expired/error connections, bounded batch</li>
 * <li>Comprehensive check: live calls to the provider for active and recently
 * failing connections, paced</li>
 * <li>Refresh sweep: proactive refresh of tokens inside the refresh buffer</li>
 * <li>Recovery sweep: retries refresh for recent error connections</li>
 * <li>Daily maintenance: logs and resets counters, optional archival</li>
 * </ul>
 * A job never overlaps its own previous run. Each connection is processed on
 * its own; a failure marks that connection as error and the sweep moves on.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "email-connections.monitor.enabled", havingValue = "true", matchIfMissing = true)
public class ConnectionHealthMonitor {

    static final String QUICK_CHECK = "quick_health_check";
    static final String COMPREHENSIVE_CHECK = "comprehensive_health_check";
    static final String REFRESH_SWEEP = "token_refresh_check";
    static final String RECOVERY = "connection_recovery";
    static final String DAILY_MAINTENANCE = "daily_maintenance";

    private static final EnumSet<ConnectionStatus> TROUBLED = EnumSet.of(ConnectionStatus.EXPIRED,
            ConnectionStatus.ERROR);
    private static final EnumSet<ConnectionStatus> SWEEP_REFRESHABLE = EnumSet.of(ConnectionStatus.ACTIVE,
            ConnectionStatus.EXPIRED);

    private final EmailConnectionRepository connectionRepository;
    private final ConnectionTokenService tokenService;
    private final EmailConnectionProperties.Monitor config;
    private final Duration refreshBuffer;
    private final Clock clock;

    private final Map<String, AtomicBoolean> running = new ConcurrentHashMap<>();
    private final AtomicLong connectionsChecked = new AtomicLong();
    private final AtomicLong tokensRefreshed = new AtomicLong();
    private final AtomicLong errorsDetected = new AtomicLong();
    private final AtomicLong connectionsRecovered = new AtomicLong();
    private volatile OffsetDateTime lastHealthCheck;

    public ConnectionHealthMonitor(EmailConnectionRepository connectionRepository,
            ConnectionTokenService tokenService, EmailConnectionProperties properties, Clock clock) {
        this.connectionRepository = connectionRepository;
        this.tokenService = tokenService;
        this.config = properties.getMonitor();
        this.refreshBuffer = properties.getRefreshBuffer();
        this.clock = clock;
    }

    // ================================================================
    // Scheduled jobs
    // ================================================================

    /**
     * @return number of connections checked
     */
    @Scheduled(fixedDelayString = "${email-connections.monitor.quick-check-interval:PT15M}",
            initialDelayString = "${email-connections.monitor.quick-check-interval:PT15M}")
    public int quickHealthCheck() {
        return runExclusive(QUICK_CHECK, () -> {
            OffsetDateTime now = OffsetDateTime.now(clock);
            List<EmailConnection> batch = connectionRepository.findStale(TROUBLED,
                    now.minus(config.getStaleAfter()), PageRequest.of(0, config.getQuickCheckBatchSize()));

            int checked = forEachIsolated(batch, connection -> {
                if (tokenService.needsRefresh(connection.getTokenExpiresAt())) {
                    attemptRefresh(connection);
                }
            }, null);

            lastHealthCheck = now;
            connectionsChecked.addAndGet(checked);
            log.debug("Quick health check completed, checked {} connection(s)", checked);
            return checked;
        });
    }

    /**
     * @return number of connections checked
     */
    @Scheduled(fixedDelayString = "${email-connections.monitor.comprehensive-check-interval:PT1H}",
            initialDelayString = "${email-connections.monitor.comprehensive-check-interval:PT1H}")
    public int comprehensiveHealthCheck() {
        return runExclusive(COMPREHENSIVE_CHECK, () -> {
            OffsetDateTime now = OffsetDateTime.now(clock);
            List<EmailConnection> connections = connectionRepository.findForComprehensiveCheck(
                    ConnectionStatus.ACTIVE, TROUBLED, now.minus(config.getRecentWindow()));

            int checked = forEachIsolated(connections, connection -> {
                if (tokenService.needsRefresh(connection.getTokenExpiresAt())) {
                    attemptRefresh(connection);
                } else if (connection.getStatus() == ConnectionStatus.ACTIVE) {
                    validateAccess(connection);
                }
            }, config.getComprehensiveCheckDelay());

            lastHealthCheck = now;
            connectionsChecked.addAndGet(checked);
            log.info("Comprehensive health check completed, checked {} connection(s)", checked);
            return checked;
        });
    }

    /**
     * @return number of connections refreshed
     */
    @Scheduled(fixedDelayString = "${email-connections.monitor.refresh-sweep-interval:PT30M}",
            initialDelayString = "PT1M")
    public int tokenRefreshSweep() {
        return runExclusive(REFRESH_SWEEP, () -> {
            OffsetDateTime threshold = OffsetDateTime.now(clock).plus(refreshBuffer);
            List<EmailConnection> expiring = connectionRepository.findRefreshCandidates(SWEEP_REFRESHABLE,
                    threshold);

            int refreshed = countSuccesses(expiring);
            log.debug("Token refresh sweep completed, refreshed {} of {} connection(s)", refreshed,
                    expiring.size());
            return refreshed;
        });
    }

    /**
     * @return number of connections recovered
     */
    @Scheduled(fixedDelayString = "${email-connections.monitor.recovery-interval:PT2H}",
            initialDelayString = "${email-connections.monitor.recovery-interval:PT2H}")
    public int connectionRecovery() {
        return runExclusive(RECOVERY, () -> {
            OffsetDateTime since = OffsetDateTime.now(clock).minus(config.getRecentWindow());
            List<EmailConnection> candidates = connectionRepository.findRecoverable(ConnectionStatus.ERROR, since,
                    PageRequest.of(0, config.getRecoveryBatchSize()));

            int recovered = countSuccesses(candidates);
            log.info("Connection recovery completed, recovered {} of {} connection(s)", recovered,
                    candidates.size());
            return recovered;
        });
    }

    /**
     * Logs the counters since the last report and resets them. Archives long
     * quiescent error connections only when {@code monitor.archive-after} is set.
     *
     * @return number of connections archived
     */
    @Scheduled(cron = "${email-connections.monitor.daily-maintenance-cron:0 0 3 * * *}")
    public int dailyMaintenance() {
        return runExclusive(DAILY_MAINTENANCE, () -> {
            OffsetDateTime now = OffsetDateTime.now(clock);
            long oldErrors = connectionRepository.countByStatusAndArchivedFalseAndUpdatedAtBefore(
                    ConnectionStatus.ERROR, now.minus(config.getOldErrorWindow()));

            log.info("Health monitoring statistics: checked={}, refreshed={}, errors={}, recovered={}, "
                    + "oldErrorConnections={}",
                    connectionsChecked.getAndSet(0),
                    tokensRefreshed.getAndSet(0),
                    errorsDetected.getAndSet(0),
                    connectionsRecovered.getAndSet(0),
                    oldErrors);

            int archived = 0;
            if (config.getArchiveAfter() != null) {
                archived = connectionRepository.archiveQuiescent(ConnectionStatus.ERROR,
                        now.minus(config.getArchiveAfter()), ConnectionStatus.ARCHIVED, now);
                if (archived > 0) {
                    log.info("Archived {} error connection(s) quiescent for more than {}", archived,
                            config.getArchiveAfter());
                }
            }
            return archived;
        });
    }

    public MonitorStatus getStatus() {
        return new MonitorStatus(
                true,
                new MonitorStatus.Stats(
                        lastHealthCheck,
                        connectionsChecked.get(),
                        tokensRefreshed.get(),
                        errorsDetected.get(),
                        connectionsRecovered.get()),
                List.of(
                        new MonitorStatus.Job(QUICK_CHECK, "Quick health check",
                                "every " + config.getQuickCheckInterval()),
                        new MonitorStatus.Job(COMPREHENSIVE_CHECK, "Comprehensive health check",
                                "every " + config.getComprehensiveCheckInterval()),
                        new MonitorStatus.Job(REFRESH_SWEEP, "Token refresh check",
                                "every " + config.getRefreshSweepInterval()),
                        new MonitorStatus.Job(RECOVERY, "Connection recovery",
                                "every " + config.getRecoveryInterval()),
                        new MonitorStatus.Job(DAILY_MAINTENANCE, "Daily maintenance",
                                "cron " + config.getDailyMaintenanceCron())));
    }

    // ================================================================
    // Per-connection work
    // ================================================================

    /**
     * @return true if the connection now holds freshly refreshed tokens
     */
    private boolean attemptRefresh(EmailConnection connection) {
        Long id = connection.getId();

        if (!connection.hasRefreshToken()) {
            if (connection.getStatus() != ConnectionStatus.ERROR) {
                log.warn("Connection {} has no refresh token", id);
                tokenService.markError(id, connection.getUserId(),
                        "No refresh token available for automatic renewal");
                errorsDetected.incrementAndGet();
            }
            return false;
        }

        try {
            tokenService.refresh(id, connection.getUserId());
        } catch (ConnectionException e) {
            // refresh() has already recorded the failure on the row
            log.warn("Connection {} token refresh failed: {}", id, e.getMessage());
            errorsDetected.incrementAndGet();
            return false;
        }

        tokensRefreshed.incrementAndGet();
        if (connection.getStatus() != ConnectionStatus.ACTIVE) {
            connectionsRecovered.incrementAndGet();
            log.info("Recovered connection {} (was {})", id, connection.getStatus().getValue());
        }
        return true;
    }

    private void validateAccess(EmailConnection connection) {
        try {
            tokenService.verifyAccess(connection.getId(), connection.getUserId());
        } catch (ConnectionException e) {
            log.warn("Connection {} validation failed: {}", connection.getId(), e.getMessage());
            errorsDetected.incrementAndGet();
        }
    }

    private int countSuccesses(List<EmailConnection> connections) {
        AtomicInteger successes = new AtomicInteger();
        forEachIsolated(connections, connection -> {
            if (attemptRefresh(connection)) {
                successes.incrementAndGet();
            }
        }, null);
        return successes.get();
    }

    /**
     * Runs {@code work} for each connection. An unexpected failure marks that
     * connection as error and does not stop the loop.
     *
     * @return number of connections processed without an unexpected failure
     */
    private int forEachIsolated(List<EmailConnection> connections, Consumer<EmailConnection> work,
            Duration pause) {
        int processed = 0;
        for (EmailConnection connection : connections) {
            try {
                work.accept(connection);
                processed++;
            } catch (RuntimeException e) {
                log.error("Error checking connection {}: {}", connection.getId(), e.getMessage(), e);
                recordUnexpectedFailure(connection, e);
            }

            if (pause != null && !pause(pause)) {
                break;
            }
        }
        return processed;
    }

    private void recordUnexpectedFailure(EmailConnection connection, RuntimeException cause) {
        errorsDetected.incrementAndGet();
        try {
            tokenService.markError(connection.getId(), connection.getUserId(),
                    "Health check failed: " + cause.getMessage());
        } catch (RuntimeException e) {
            log.error("Could not mark connection {} as error: {}", connection.getId(), e.getMessage());
        }
    }

    private boolean pause(Duration pause) {
        if (pause.isZero() || pause.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(pause.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Health check interrupted, stopping sweep");
            return false;
        }
    }

    private int runExclusive(String jobId, Supplier<Integer> job) {
        AtomicBoolean flag = running.computeIfAbsent(jobId, k -> new AtomicBoolean());
        if (!flag.compareAndSet(false, true)) {
            log.debug("Job {} still running, skipping this run", jobId);
            return 0;
        }
        try {
            return job.get();
        } catch (RuntimeException e) {
            log.error("Job {} failed: {}", jobId, e.getMessage(), e);
            return 0;
        } finally {
            flag.set(false);
        }
    }
}
