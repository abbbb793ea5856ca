package com.microservices.learningservice.repository;

import com.microservices.learningservice.model.RoleName;
import com.microservices.learningservice.model.UserProfile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface UserProfileRepository extends JpaRepository<UserProfile, Long> {
    List<UserProfile> findByRole_Name(RoleName name);
}
