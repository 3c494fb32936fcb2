package org.tfregistry.webserver.scm.controller;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.tfregistry.scmclient.ScmApiException;
import org.tfregistry.scmclient.model.ScmBranch;
import org.tfregistry.scmclient.model.ScmRepository;
import org.tfregistry.scmclient.model.ScmTag;
import org.tfregistry.webserver.exception.ScmReconnectRequiredException;
import org.tfregistry.webserver.exception.ScmUpstreamException;
import org.tfregistry.webserver.exception.UnauthenticatedException;
import org.tfregistry.webserver.scm.service.ScmRepositoryService;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;
import static org.tfregistry.webserver.scm.controller.ScmControllerTestSupport.PROVIDER_ID;
import static org.tfregistry.webserver.scm.controller.ScmControllerTestSupport.USER_ID;

@ExtendWith(MockitoExtension.class)
@DisplayName("ScmRepositoryController")
class ScmRepositoryControllerTest {

    private static final String BASE = "/api/v1/scm-providers/" + PROVIDER_ID + "/repositories";

    @Mock
    private ScmRepositoryService repositoryService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = ScmControllerTestSupport.mockMvc(new ScmRepositoryController(repositoryService));
        ScmControllerTestSupport.signIn(USER_ID);
    }

    @AfterEach
    void tearDown() {
        ScmControllerTestSupport.signOut();
    }

    @Test
    @DisplayName("should list repositories matching the search term")
    void shouldListRepositories() throws Exception {
        ScmRepository repo = new ScmRepository("1", "terraform-aws-vpc", "acme/terraform-aws-vpc", "acme", null,
                "main", "https://github.com/acme/terraform-aws-vpc.git", "https://github.com/acme/terraform-aws-vpc", true);
        when(repositoryService.listRepositories(PROVIDER_ID, USER_ID, "vpc")).thenReturn(List.of(repo));

        mockMvc.perform(get(BASE).param("search", "vpc"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.repositories[0].full_name").value("acme/terraform-aws-vpc"))
                .andExpect(jsonPath("$.repositories[0].private").value(true));
    }

    @Test
    @DisplayName("should list tags")
    void shouldListTags() throws Exception {
        when(repositoryService.listTags(PROVIDER_ID, USER_ID, "acme", "vpc"))
                .thenReturn(List.of(new ScmTag("v1.0.0", "abc123", null, null, null)));

        mockMvc.perform(get(BASE + "/acme/vpc/tags"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tags[0].name").value("v1.0.0"))
                .andExpect(jsonPath("$.tags[0].commit_sha").value("abc123"));
    }

    @Test
    @DisplayName("should list branches")
    void shouldListBranches() throws Exception {
        when(repositoryService.listBranches(PROVIDER_ID, USER_ID, "acme", "vpc"))
                .thenReturn(List.of(new ScmBranch("main", "abc123", true, true)));

        mockMvc.perform(get(BASE + "/acme/vpc/branches"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.branches[0].default").value(true));
    }

    @Test
    @DisplayName("should ask the user to reconnect when the provider keeps rejecting the credential")
    void shouldAskToReconnect() throws Exception {
        when(repositoryService.listRepositories(PROVIDER_ID, USER_ID, null))
                .thenThrow(new ScmReconnectRequiredException(new ScmApiException(401, "Bad credentials")));

        mockMvc.perform(get(BASE))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.errorCode").value("RECONNECT_REQUIRED"))
                .andExpect(jsonPath("$.error").value(ScmReconnectRequiredException.MESSAGE));
    }

    @Test
    @DisplayName("should report a missing connection")
    void shouldReportNotConnected() throws Exception {
        when(repositoryService.listTags(PROVIDER_ID, USER_ID, "acme", "vpc"))
                .thenThrow(new UnauthenticatedException("not connected to this provider"));

        mockMvc.perform(get(BASE + "/acme/vpc/tags"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("not connected to this provider"));
    }

    @Test
    @DisplayName("should surface upstream failures with their detail")
    void shouldSurfaceUpstreamFailure() throws Exception {
        when(repositoryService.listBranches(PROVIDER_ID, USER_ID, "acme", "vpc"))
                .thenThrow(new ScmUpstreamException("failed to list branches: HTTP 500: boom",
                        new ScmApiException(500, "boom")));

        mockMvc.perform(get(BASE + "/acme/vpc/branches"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("failed to list branches: HTTP 500: boom"));
    }
}
