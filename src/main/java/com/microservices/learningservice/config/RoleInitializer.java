package com.microservices.learningservice.config;

import com.microservices.learningservice.service.AccountBootstrapService;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RoleInitializer {

    private final AccountBootstrapService accountBootstrapService;

    @PostConstruct
    public void init() {
        accountBootstrapService.ensureRoles();
        accountBootstrapService.ensureAdminAccount();
    }
}
