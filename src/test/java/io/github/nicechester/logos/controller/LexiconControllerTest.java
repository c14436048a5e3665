package io.github.nicechester.logos.controller;

import io.github.nicechester.logos.parser.StrongsNumberNormalizer;
import io.github.nicechester.logos.service.BibleDataService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Optional;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = LexiconController.class)
@Import(StrongsNumberNormalizer.class)
class LexiconControllerTest {

    @Autowired MockMvc mvc;
    @MockBean BibleDataService bibleDataService;

    @Test
    void returnsDefinitionForNormalizedNumber() throws Exception {
        when(bibleDataService.findDefinition("G25")).thenReturn(Optional.of("to love"));

        mvc.perform(get("/api/lexicon/g0025"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.strongsNumber").value("G25"))
            .andExpect(jsonPath("$.definition").value("to love"));
    }

    @Test
    void unknownNumberIsNotFound() throws Exception {
        when(bibleDataService.findDefinition("H1")).thenReturn(Optional.empty());

        mvc.perform(get("/api/lexicon/H0001"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("Lexicon entry not found for: 'H1'"));
    }

    @Test
    void malformedNumberIsBadRequest() throws Exception {
        mvc.perform(get("/api/lexicon/X25"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Invalid Strong's number: 'X25'"));

        verify(bibleDataService, never()).findDefinition(anyString());
    }
}
