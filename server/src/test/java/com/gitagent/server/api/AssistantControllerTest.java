package com.gitagent.server.api;

import com.gitagent.server.assistant.ChangeAnalyzer;
import com.gitagent.server.assistant.ChangeAnalyzer.ChatReply;
import com.gitagent.server.gemini.GeminiClient.GeminiApiException;
import com.gitagent.server.git.GitCommandException;
import com.gitagent.server.git.GitOperations;
import com.gitagent.server.session.RepositorySession;
import com.gitagent.server.session.SessionManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AssistantController.class)
class AssistantControllerTest {

    @Autowired MockMvc mockMvc;

    @MockitoBean SessionManager sessions;
    @MockitoBean ChangeAnalyzer analyzer;

    GitOperations git;

    @BeforeEach
    void setUp() {
        RepositorySession session = mock(RepositorySession.class);
        git = mock(GitOperations.class);
        when(sessions.require()).thenReturn(session);
        when(session.git()).thenReturn(git);
    }

    @Test
    void chat_freshRepository_fallsBackToPlaceholderContext() throws Exception {
        when(git.shortStatus()).thenReturn("");
        when(git.log(10)).thenThrow(new GitCommandException("git log failed: no commits", 128));
        when(analyzer.chat("what now?", "No changes.", "No recent commits."))
                .thenReturn(new ChatReply("Make your first commit.", "commit \"Initial commit\""));

        mockMvc.perform(post("/api/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"what now?\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.response").value("Make your first commit."))
                .andExpect(jsonPath("$.dsl").value("commit \"Initial commit\""));
    }

    @Test
    void chat_noMessage_returns400() throws Exception {
        mockMvc.perform(post("/api/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("No message provided"));
    }

    @Test
    void chat_geminiFailure_returns500() throws Exception {
        when(git.shortStatus()).thenReturn(" M a.txt");
        when(git.log(10)).thenReturn("abc first");
        when(analyzer.chat(anyString(), anyString(), anyString()))
                .thenThrow(new GeminiApiException("GEMINI_API_KEY environment variable is not set."));

        mockMvc.perform(post("/api/chat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"hi\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("GEMINI_API_KEY environment variable is not set."));
    }

    @Test
    void execute_runsScriptAndReturnsTranscript() throws Exception {
        mockMvc.perform(post("/api/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dsl\":\"pull\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.output").value(org.hamcrest.Matchers.containsString("Successfully pulled changes.")));
        verify(git).pull();
    }

    @Test
    void execute_emptyScript_returns400() throws Exception {
        mockMvc.perform(post("/api/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dsl\":\"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("No DSL code provided"));
    }
}
