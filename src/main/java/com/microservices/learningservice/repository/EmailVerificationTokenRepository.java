package com.microservices.learningservice.repository;

import com.microservices.learningservice.model.EmailVerificationToken;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface EmailVerificationTokenRepository extends JpaRepository<EmailVerificationToken, Long> {
    Optional<EmailVerificationToken> findByToken(String token);

    // bulk delete runs immediately, so a replacement row for the same user can be inserted afterwards
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from EmailVerificationToken t where t.user.id = :userId")
    int deleteAllForUser(@Param("userId") Long userId);
}
