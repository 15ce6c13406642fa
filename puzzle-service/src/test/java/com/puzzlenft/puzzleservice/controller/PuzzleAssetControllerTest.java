package com.puzzlenft.puzzleservice.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.puzzlenft.puzzleservice.model.EntropySnapshot;
import com.puzzlenft.puzzleservice.model.Identity;
import com.puzzlenft.puzzleservice.security.JwtUtil;
import com.puzzlenft.puzzleservice.service.EntropySource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "puzzle.authority.identity=" + PuzzleAssetControllerTest.AUTHORITY_HEX)
@AutoConfigureMockMvc
class PuzzleAssetControllerTest {

    static final String AUTHORITY_HEX = "aaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa";

    private static final Identity OWNER = Identity.fromHex("0f".repeat(32));
    private static final Identity STRANGER = Identity.fromHex("f0".repeat(32));

    private static final String MINT_BODY = """
            {"name": "Puzzle #7", "uri": "https://example.com/7.json", "puzzleType": 0, "difficulty": 1,
             "attributes": [{"key": "artist", "value": "someone"}]}
            """;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private JwtUtil jwtUtil;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private EntropySource entropySource;

    @BeforeEach
    void setUp() {
        when(entropySource.snapshot()).thenReturn(new EntropySnapshot(42, 1_700_000_012L));
    }

    private String bearer(Identity identity) {
        return "Bearer " + jwtUtil.issueToken(identity);
    }

    private String mint() throws Exception {
        MvcResult result = mockMvc.perform(post("/api/assets")
                        .header("Authorization", bearer(OWNER))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(MINT_BODY))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.puzzleType").value("math_factor"))
                .andExpect(jsonPath("$.puzzleNumber").value(186))
                .andExpect(jsonPath("$.minter").value(OWNER.toHex()))
                .andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        return body.get("assetId").asText();
    }

    @Test
    void testMintAndSolve() throws Exception {
        String assetId = mint();

        mockMvc.perform(post("/api/assets/{id}/solve", assetId)
                        .header("Authorization", bearer(OWNER))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"solution\": 7}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("INCORRECT_SOLUTION"));

        mockMvc.perform(post("/api/assets/{id}/solve", assetId)
                        .header("Authorization", bearer(OWNER))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"solution\": 93, \"newUri\": \"https://example.com/7-solved.json\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.solver").value(OWNER.toHex()))
                .andExpect(jsonPath("$.rarity").value("Epic"))
                .andExpect(jsonPath("$.solveTimestamp").value(1_700_000_012))
                .andExpect(jsonPath("$.asset.uri").value("https://example.com/7-solved.json"));

        mockMvc.perform(post("/api/assets/{id}/solve", assetId)
                        .header("Authorization", bearer(OWNER))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"solution\": 93}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("ALREADY_SOLVED"));
    }

    @Test
    void testBlankNewUriRejected() throws Exception {
        String assetId = mint();

        mockMvc.perform(post("/api/assets/{id}/solve", assetId)
                        .header("Authorization", bearer(OWNER))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"solution\": 93, \"newUri\": \"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_REQUEST"));

        mockMvc.perform(get("/api/assets/{id}", assetId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.uri").value("https://example.com/7.json"));
    }

    @Test
    void testStrangerCannotSolve() throws Exception {
        String assetId = mint();

        mockMvc.perform(post("/api/assets/{id}/solve", assetId)
                        .header("Authorization", bearer(STRANGER))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"solution\": 2}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("NOT_NFT_OWNER"));
    }

    @Test
    void testUriUpdate() throws Exception {
        String assetId = mint();
        String body = "{\"uri\": \"https://example.com/moved.json\"}";

        mockMvc.perform(patch("/api/assets/{id}/uri", assetId)
                        .header("Authorization", bearer(OWNER))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("UNAUTHORIZED_UPDATE"));

        mockMvc.perform(patch("/api/assets/{id}/uri", assetId)
                        .header("Authorization", bearer(Identity.fromHex(AUTHORITY_HEX)))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.uri").value("https://example.com/moved.json"));
    }

    @Test
    void testBadRequests() throws Exception {
        mockMvc.perform(post("/api/assets")
                        .header("Authorization", bearer(OWNER))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"x\", \"uri\": \"u\", \"puzzleType\": 5, \"difficulty\": 1}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_PUZZLE_TYPE"));

        mockMvc.perform(post("/api/assets")
                        .header("Authorization", bearer(OWNER))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"x\", \"uri\": \"u\", \"puzzleType\": 0, \"difficulty\": 300}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_REQUEST"));

        mockMvc.perform(post("/api/assets")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(MINT_BODY))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("UNAUTHENTICATED"));

        mockMvc.perform(post("/api/assets")
                        .header("Authorization", bearer(OWNER))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"x\", \"uri\": \"u\", \"puzzleType\": 0, \"difficulty\": 1, "
                                + "\"attributes\": [{\"key\": \"artist\", \"value\": \"" + "x".repeat(300) + "\"}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_REQUEST"));

        mockMvc.perform(get("/api/assets/{id}", "missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    @Test
    void testCollectionListing() throws Exception {
        MvcResult created = mockMvc.perform(post("/api/collections")
                        .header("Authorization", bearer(OWNER))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Riddles\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.name").value("Riddles"))
                .andExpect(jsonPath("$.updateAuthority").value(AUTHORITY_HEX))
                .andReturn();
        String collectionId = objectMapper.readTree(created.getResponse().getContentAsString()).get("id").asText();

        mockMvc.perform(post("/api/assets")
                        .header("Authorization", bearer(OWNER))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"x\", \"uri\": \"u\", \"puzzleType\": 2, \"difficulty\": 0, "
                                + "\"collectionId\": \"" + collectionId + "\"}"))
                .andExpect(status().isCreated());

        mockMvc.perform(get("/api/collections/{id}/assets", collectionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].collectionId").value(collectionId));
    }
}
