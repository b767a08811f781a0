package com.yoursp.emailconnections.repository;

import com.yoursp.emailconnections.model.ConnectionStatus;
import com.yoursp.emailconnections.model.entity.EmailConnection;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface EmailConnectionRepository extends JpaRepository<EmailConnection, Long> {

    Optional<EmailConnection> findByIdAndUserId(Long id, Long userId);

    List<EmailConnection> findByUserIdAndArchivedFalseOrderByCreatedAtDesc(Long userId);

    List<EmailConnection> findByUserIdOrderByCreatedAtDesc(Long userId);

    @Query("SELECT c FROM EmailConnection c WHERE c.userId = :userId AND c.provider = :provider " +
            "AND LOWER(c.emailAddress) = LOWER(:emailAddress) AND c.archived = false")
    Optional<EmailConnection> findLiveConnection(Long userId, String emailAddress, String provider);

    // ── Monitor sweeps ──

    @Query("SELECT c FROM EmailConnection c WHERE c.archived = false AND c.status IN :statuses " +
            "AND c.updatedAt < :staleBefore ORDER BY c.updatedAt ASC")
    List<EmailConnection> findStale(Collection<ConnectionStatus> statuses, OffsetDateTime staleBefore,
            Pageable pageable);

    @Query("SELECT c FROM EmailConnection c WHERE c.archived = false AND (c.status = :healthy " +
            "OR (c.status IN :troubled AND c.updatedAt > :since)) ORDER BY c.id ASC")
    List<EmailConnection> findForComprehensiveCheck(ConnectionStatus healthy,
            Collection<ConnectionStatus> troubled, OffsetDateTime since);

    @Query("SELECT c FROM EmailConnection c WHERE c.archived = false AND c.status IN :statuses " +
            "AND c.refreshTokenEncrypted IS NOT NULL AND c.refreshTokenEncrypted <> '' " +
            "AND (c.tokenExpiresAt IS NULL OR c.tokenExpiresAt <= :threshold) ORDER BY c.tokenExpiresAt ASC")
    List<EmailConnection> findRefreshCandidates(Collection<ConnectionStatus> statuses, OffsetDateTime threshold);

    @Query("SELECT c FROM EmailConnection c WHERE c.archived = false AND c.status = :status " +
            "AND c.refreshTokenEncrypted IS NOT NULL AND c.refreshTokenEncrypted <> '' " +
            "AND c.updatedAt > :since ORDER BY c.updatedAt DESC")
    List<EmailConnection> findRecoverable(ConnectionStatus status, OffsetDateTime since, Pageable pageable);

    long countByStatusAndArchivedFalseAndUpdatedAtBefore(ConnectionStatus status, OffsetDateTime before);

    /**
     * Archives connections that have sat in {@code status} since before
     * {@code before}.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE EmailConnection c SET c.archived = true, c.archivedAt = :now, c.status = :archivedStatus, " +
            "c.updatedAt = :now WHERE c.archived = false AND c.status = :status AND c.updatedAt < :before")
    int archiveQuiescent(ConnectionStatus status, OffsetDateTime before, ConnectionStatus archivedStatus,
            OffsetDateTime now);

    // ── Conditional writes ──

    /**
     * Compare-and-swap of the token triple. Succeeds only while the stored refresh
     * ciphertext still equals {@code expectedRefresh}, so two concurrent refreshes
     * of one connection cannot both commit.
     *
     * @return 1 if the swap happened, 0 otherwise
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE EmailConnection c SET c.accessTokenEncrypted = :accessToken, " +
            "c.refreshTokenEncrypted = :refreshToken, c.tokenExpiresAt = :expiresAt, " +
            "c.status = :newStatus, c.errorMessage = NULL, c.lastSyncAt = :now, c.updatedAt = :now " +
            "WHERE c.id = :id AND c.refreshTokenEncrypted = :expectedRefresh AND c.archived = false " +
            "AND c.status IN :fromStatuses")
    int swapTokens(Long id, String expectedRefresh, String accessToken, String refreshToken,
            OffsetDateTime expiresAt, ConnectionStatus newStatus, Collection<ConnectionStatus> fromStatuses,
            OffsetDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE EmailConnection c SET c.status = :newStatus, c.errorMessage = :errorMessage, " +
            "c.updatedAt = :now WHERE c.id = :id AND c.archived = false AND c.status IN :fromStatuses")
    int markStatus(Long id, ConnectionStatus newStatus, String errorMessage,
            Collection<ConnectionStatus> fromStatuses, OffsetDateTime now);

    /**
     * Like {@link #markStatus} but only while the refresh ciphertext is unchanged,
     * so a failure report cannot overwrite a refresh that succeeded concurrently.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE EmailConnection c SET c.status = :newStatus, c.errorMessage = :errorMessage, " +
            "c.updatedAt = :now WHERE c.id = :id AND c.archived = false AND c.status IN :fromStatuses " +
            "AND c.refreshTokenEncrypted = :expectedRefresh")
    int markStatusIfRefreshUnchanged(Long id, String expectedRefresh, ConnectionStatus newStatus,
            String errorMessage, Collection<ConnectionStatus> fromStatuses, OffsetDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE EmailConnection c SET c.lastSyncAt = :now, c.updatedAt = :now, " +
            "c.status = :healthy, c.errorMessage = NULL " +
            "WHERE c.id = :id AND c.archived = false AND c.status IN :fromStatuses")
    int markHealthy(Long id, ConnectionStatus healthy, Collection<ConnectionStatus> fromStatuses,
            OffsetDateTime now);

    // ── User edits: touch only their own columns, never the token triple ──

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE EmailConnection c SET c.connectionName = :name, c.updatedAt = :now " +
            "WHERE c.id = :id AND c.userId = :userId")
    int rename(Long id, Long userId, String name, OffsetDateTime now);

    /**
     * Status change that leaves the error message alone. Applies only while the
     * row is still in one of {@code fromStatuses}.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE EmailConnection c SET c.status = :newStatus, c.updatedAt = :now " +
            "WHERE c.id = :id AND c.archived = false AND c.status IN :fromStatuses")
    int updateStatus(Long id, ConnectionStatus newStatus, Collection<ConnectionStatus> fromStatuses,
            OffsetDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE EmailConnection c SET c.archived = true, c.archivedAt = :now, c.status = :archivedStatus, " +
            "c.updatedAt = :now WHERE c.id = :id AND c.archived = false AND c.status IN :fromStatuses")
    int archive(Long id, ConnectionStatus archivedStatus, Collection<ConnectionStatus> fromStatuses,
            OffsetDateTime now);

    /**
     * Hides a row without touching its status; used for terminal rows such as
     * revoked ones.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE EmailConnection c SET c.archived = true, c.archivedAt = :now, c.updatedAt = :now " +
            "WHERE c.id = :id AND c.archived = false")
    int archiveKeepingStatus(Long id, OffsetDateTime now);
}
