package com.microservices.learningservice.repository;

import com.microservices.learningservice.model.Role;
import com.microservices.learningservice.model.RoleName;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface RoleRepository extends JpaRepository<Role, Long> {
    Optional<Role> findByName(RoleName name);
    Optional<Role> findByNameAndActiveTrue(RoleName name);
}
