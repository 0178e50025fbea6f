package com.facilitydesk.backend.modules.auth.infrastructure.persistence;

import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

import com.facilitydesk.backend.modules.auth.domain.FacilityUser;
import com.facilitydesk.backend.modules.auth.domain.UserRole;
import com.facilitydesk.backend.modules.auth.domain.UserStatus;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface FacilityUserRepository extends JpaRepository<FacilityUser, UUID> {

    @Query("select fu from FacilityUser fu where fu.id = :id and fu.deleted = false")
    Optional<FacilityUser> findActiveById(@Param("id") UUID id);

    @Query("select fu from FacilityUser fu where lower(fu.email) = lower(:email) and fu.deleted = false")
    Optional<FacilityUser> findActiveByEmail(@Param("email") String email);

    @Query("select fu from FacilityUser fu where lower(fu.username) = lower(:username) and fu.deleted = false")
    Optional<FacilityUser> findActiveByUsername(@Param("username") String username);

    @Query("select fu from FacilityUser fu where fu.emailVerificationTokenHash = :tokenHash and fu.deleted = false")
    Optional<FacilityUser> findByEmailVerificationTokenHash(@Param("tokenHash") String tokenHash);

    @Query("select fu from FacilityUser fu where fu.passwordResetTokenHash = :tokenHash and fu.deleted = false")
    Optional<FacilityUser> findByPasswordResetTokenHash(@Param("tokenHash") String tokenHash);

    @Query("select count(fu) > 0 from FacilityUser fu where lower(fu.email) = lower(:email)")
    boolean existsByEmailIgnoreCase(@Param("email") String email);

    @Query("select count(fu) > 0 from FacilityUser fu where lower(fu.username) = lower(:username)")
    boolean existsByUsernameIgnoreCase(@Param("username") String username);

    @Query("select count(fu) > 0 from FacilityUser fu where lower(fu.email) = lower(:email) and fu.id <> :id")
    boolean existsByEmailIgnoreCaseAndIdNot(@Param("email") String email, @Param("id") UUID id);

    @Query("select count(fu) > 0 from FacilityUser fu where lower(fu.username) = lower(:username) and fu.id <> :id")
    boolean existsByUsernameIgnoreCaseAndIdNot(@Param("username") String username, @Param("id") UUID id);

    boolean existsByRoleAndDeletedFalse(UserRole role);

    @Query("""
            select fu
              from FacilityUser fu
             where fu.deleted = false
               and (:role is null or fu.role = :role)
               and (:status is null or fu.status = :status)
               and (
                     :searchPattern is null
                  or lower(fu.email) like :searchPattern
                  or lower(fu.firstName) like :searchPattern
                  or lower(fu.lastName) like :searchPattern
                  or lower(fu.username) like :searchPattern
               )
            """)
    Page<FacilityUser> search(
            @Param("role") UserRole role,
            @Param("status") UserStatus status,
            @Param("searchPattern") String searchPattern,
            Pageable pageable
    );

    @Query("""
            select distinct fu
              from FacilityUser fu
              join fu.managedFacilities facility
             where fu.deleted = false
               and facility = :facilityId
               and fu.id <> :excludedUserId
               and fu.role not in :excludedRoles
               and (:role is null or fu.role = :role)
               and (:status is null or fu.status = :status)
            """)
    Page<FacilityUser> findEmployeesByFacility(
            @Param("facilityId") UUID facilityId,
            @Param("excludedUserId") UUID excludedUserId,
            @Param("excludedRoles") Collection<UserRole> excludedRoles,
            @Param("role") UserRole role,
            @Param("status") UserStatus status,
            Pageable pageable
    );
}
