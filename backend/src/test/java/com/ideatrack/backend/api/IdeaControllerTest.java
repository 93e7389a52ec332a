package com.ideatrack.backend.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.ideatrack.backend.support.IdeaTrackFixture;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class IdeaControllerTest {

    private final IdeaTrackFixture f = new IdeaTrackFixture();

    private final MockMvc mvc = MockMvcBuilders
            .standaloneSetup(
                    new IdeaController(f.submissions, f.lineage, f.outcomes),
                    new LineageController(f.lineage),
                    new OwnerController(f.reputation, f.timeCapsule, f.history),
                    new AdminController(f.reputation))
            .setControllerAdvice(new ApiExceptionHandler())
            .setMessageConverters(new MappingJackson2HttpMessageConverter(f.om))
            .build();

    private String submit(String ownerId, String confidence) throws Exception {
        String body = mvc.perform(post("/api/v1/ideas")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ownerId\":\"" + ownerId + "\",\"text\":\"solar roads\",\"confidence\":" + confidence + "}"))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        JsonNode json = f.om.readTree(body);
        return json.get("trackingId").asText();
    }

    private String linkBody(String parent, String child) {
        return "{\"parentTrackingId\":\"" + parent + "\",\"childTrackingId\":\"" + child
                + "\",\"refinementType\":\"technical_depth\"}";
    }

    @Test
    void submitReturnsTrackingId() throws Exception {
        mvc.perform(post("/api/v1/ideas")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ownerId\":\"alice\",\"text\":\"solar roads\",\"confidence\":0.7}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.trackingId", startsWith("IDEA-")))
                .andExpect(jsonPath("$.submission.status").value("submitted"))
                .andExpect(jsonPath("$.submission.confidence").value(0.7));
    }

    @Test
    void confidenceOutOfRangeIsValidationError() throws Exception {
        mvc.perform(post("/api/v1/ideas")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ownerId\":\"alice\",\"text\":\"x\",\"confidence\":1.5}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));

        assertThat(f.store.submissions).isEmpty();
    }

    @Test
    void unknownIdeaIsNotFound() throws Exception {
        mvc.perform(get("/api/v1/ideas/IDEA-ZZZZZZ"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    @Test
    void linkAndCycle() throws Exception {
        String a = submit("alice", "0.5");
        String b = submit("alice", "null");

        mvc.perform(post("/api/v1/lineage").contentType(MediaType.APPLICATION_JSON).content(linkBody(a, b)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.edgeId").value("EDGE-" + b))
                .andExpect(jsonPath("$.edge.refinementType").value("technical_depth"));

        mvc.perform(post("/api/v1/lineage").contentType(MediaType.APPLICATION_JSON).content(linkBody(b, a)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("LINEAGE_CYCLE"));

        mvc.perform(get("/api/v1/ideas/" + b + "/ancestors"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].distance").value(1));
        mvc.perform(get("/api/v1/ideas/" + a + "/ancestors"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));
        mvc.perform(get("/api/v1/ideas/" + a + "/children"))
                .andExpect(jsonPath("$[0].id").value(b));
    }

    @Test
    void unknownRefinementTypeIsRejected() throws Exception {
        String a = submit("alice", "null");
        String b = submit("alice", "null");

        mvc.perform(post("/api/v1/lineage").contentType(MediaType.APPLICATION_JSON)
                        .content(linkBody(a, b).replace("technical_depth", "rewrite")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
    }

    @Test
    void recordOutcomeThenReadProfile() throws Exception {
        String a = submit("alice", "0.8");

        mvc.perform(get("/api/v1/ideas/" + a + "/outcome"))
                .andExpect(status().isNotFound());

        mvc.perform(post("/api/v1/ideas/" + a + "/outcome")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"result\":1.0,\"validationSource\":\"press\",\"validatedAt\":\"2025-07-16T00:00:00Z\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcomeId").value("OUTCOME-" + a))
                .andExpect(jsonPath("$.outcome.daysElapsed").value(196.0))
                .andExpect(jsonPath("$.warnings", hasSize(0)));

        mvc.perform(get("/api/v1/owners/alice/profile"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalValidations").value(1))
                .andExpect(jsonPath("$.accuracyRate").value(1.0));

        mvc.perform(get("/api/v1/owners/alice/time-capsule"))
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].submission.id").value(a));
    }

    @Test
    void malformedOutcomeDateIsBadRequest() throws Exception {
        String a = submit("alice", "0.8");

        mvc.perform(post("/api/v1/ideas/" + a + "/outcome")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"result\":0.4,\"validationSource\":\"press\",\"validatedAt\":\"yesterday\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("invalid_validatedAt"));
    }

    @Test
    void rebuildReturnsProfiles() throws Exception {
        submit("alice", "0.8");
        submit("bob", "0.2");

        mvc.perform(post("/api/v1/admin/rebuild"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.profiles").value(2));
    }
}
