package ch.so.arp.finrag.retrieval;

import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import jakarta.validation.Valid;

/**
 * Runs a retrieval strategy directly, without the planner.
 */
@RestController
@RequestMapping(path = "/api/retrieval", produces = MediaType.APPLICATION_JSON_VALUE)
@Validated
public class RetrievalController {

    private final RetrievalService retrievalService;

    public RetrievalController(RetrievalService retrievalService) {
        this.retrievalService = retrievalService;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public RetrievalResult retrieve(@Valid @RequestBody RetrievalRequest request) {
        int topK = request.topK() == null ? retrievalService.defaultTopK() : request.topK();
        return retrievalService.retrieve(request.toQuery(), topK, request.filter());
    }
}
