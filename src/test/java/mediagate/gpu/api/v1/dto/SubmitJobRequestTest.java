package mediagate.gpu.api.v1.dto;

import com.fasterxml.jackson.databind.ObjectMapper;
import mediagate.gpu.config.GatewayConfig;
import mediagate.gpu.model.Job;
import mediagate.gpu.model.JobKind;
import mediagate.gpu.model.JobPayload;
import mediagate.gpu.model.PriorityTier;
import mediagate.gpu.server.RouterHandler;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SubmitJobRequestTest {

    private final ObjectMapper mapper = RouterHandler.mapper();

    @Test
    void parsesTypedPayload() throws Exception {
        SubmitJobRequest req = mapper.readValue("""
                {"tier":"high","vramEstimateMb":9000,
                 "payload":{"kind":"video","model":"hunyuan","prompt":"waves","durationSeconds":5,"fps":24}}
                """, SubmitJobRequest.class);

        req.validate();
        Job job = req.toJob();

        assertEquals(JobKind.VIDEO, job.kind());
        assertEquals(PriorityTier.HIGH, job.tier());
        assertEquals(9000 * GatewayConfig.MB, job.vramEstimate());
        assertEquals("hunyuan", job.modelName());
        assertTrue(job.id().startsWith("job-"));
        assertInstanceOf(JobPayload.VideoPayload.class, job.payload());
    }

    @Test
    void kindAloneIsEnough() {
        SubmitJobRequest req = new SubmitJobRequest("speech", null, null, null);

        req.validate();
        Job job = req.toJob();

        assertEquals(JobKind.SPEECH, job.kind());
        assertEquals(PriorityTier.NORMAL, job.tier());
        assertEquals(0, job.vramEstimate());
    }

    @Test
    void rejectsInvalidRequests() {
        JobPayload image = new JobPayload.ImagePayload("SDXL", "a cat", 1024, 1024, 1);

        assertThrows(IllegalArgumentException.class, () -> new SubmitJobRequest(null, null, null, null).validate());
        assertThrows(IllegalArgumentException.class, () -> new SubmitJobRequest("hologram", null, null, null).validate());
        assertThrows(IllegalArgumentException.class, () -> new SubmitJobRequest("image", "urgent", null, null).validate());
        assertThrows(IllegalArgumentException.class, () -> new SubmitJobRequest("image", null, -5L, null).validate());
        assertThrows(IllegalArgumentException.class, () -> new SubmitJobRequest("video", null, null, image).validate());
        assertThrows(IllegalArgumentException.class, () -> new SubmitJobRequest(null, null, null,
                new JobPayload.ImagePayload("SDXL", " ", 1024, 1024, 1)).validate());
    }
}
