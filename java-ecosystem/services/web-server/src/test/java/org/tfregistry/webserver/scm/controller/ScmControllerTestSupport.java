package org.tfregistry.webserver.scm.controller;

import org.tfregistry.security.service.UserPrincipal;
import org.tfregistry.webserver.exception.GlobalExceptionHandler;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.method.annotation.AuthenticationPrincipalArgumentResolver;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.UUID;

final class ScmControllerTestSupport {

    static final UUID USER_ID = UUID.fromString("0b7c5a4e-3f0d-4c59-9b7e-2d1f6a8c9e01");
    static final UUID PROVIDER_ID = UUID.fromString("5e2d8f1a-7c3b-4a6e-8d9f-1b2c3d4e5f60");

    private ScmControllerTestSupport() {
    }

    static MockMvc mockMvc(Object controller) {
        return MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .setCustomArgumentResolvers(new AuthenticationPrincipalArgumentResolver())
                .build();
    }

    static void signIn(UUID userId) {
        SecurityContextHolder.getContext().setAuthentication(
                new UsernamePasswordAuthenticationToken(new UserPrincipal(userId), null, List.of()));
    }

    static void signOut() {
        SecurityContextHolder.clearContext();
    }
}
