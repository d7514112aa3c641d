package mediagate.gpu.api.internal.v1.dto;

import mediagate.gpu.server.RouterHandler;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CompleteJobRequestTest {

    @Test
    void successIsRequired() throws Exception {
        CompleteJobRequest missing = RouterHandler.mapper().readValue("{\"error\":\"oom\"}", CompleteJobRequest.class);

        assertThrows(IllegalArgumentException.class, missing::validate);
    }

    @Test
    void failureCarriesError() throws Exception {
        CompleteJobRequest req = RouterHandler.mapper()
                .readValue("{\"success\":false,\"error\":\"CUDA out of memory\"}", CompleteJobRequest.class);

        req.validate();

        assertFalse(req.success());
        assertEquals("CUDA out of memory", req.error());
    }
}
