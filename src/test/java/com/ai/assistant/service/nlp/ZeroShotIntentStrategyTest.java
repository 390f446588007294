package com.ai.assistant.service.nlp;

import com.ai.assistant.client.ZeroShotModel;
import com.ai.assistant.conversation.Intent;
import com.ai.assistant.conversation.IntentResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ZeroShotIntentStrategyTest {

    @Mock
    private ZeroShotModel model;

    @Test
    void picksTheBestLabelAboveTheFloor() {
        when(model.isConfigured()).thenReturn(true);
        when(model.score(eq("set something up with Ana"), anyList(), eq(ZeroShotIntentStrategy.HYPOTHESIS_TEMPLATE)))
                .thenReturn(Map.of("scheduling a meeting", 0.81, "sending an email", 0.1, "checking calendar", 0.09));

        IntentResult result = new ZeroShotIntentStrategy(model).tryClassify("set something up with Ana").orElseThrow();

        assertEquals(Intent.SCHEDULE_MEETING, result.getIntent());
        assertEquals(0.81, result.getConfidence(), 1e-9);
    }

    @Test
    void fallsThroughBelowTheFloor() {
        when(model.isConfigured()).thenReturn(true);
        when(model.score(any(), anyList(), any()))
                .thenReturn(Map.of("checking availability", 0.64, "finding contact information", 0.36));

        assertTrue(new ZeroShotIntentStrategy(model).tryClassify("hmm").isEmpty());
    }

    @Test
    void skippedWhenNotConfigured() {
        when(model.isConfigured()).thenReturn(false);

        assertTrue(new ZeroShotIntentStrategy(model).tryClassify("anything").isEmpty());
        verify(model, never()).score(any(), anyList(), any());
    }
}
