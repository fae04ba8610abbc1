package tw.gc.auto.control.controllers;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import tw.gc.auto.control.entities.ControlEvent;
import tw.gc.auto.control.repositories.ControlEventRepository;

import java.util.List;

@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
public class EventController {

    private final ControlEventRepository eventRepository;

    @GetMapping
    public ResponseEntity<List<ControlEvent>> getRecentEvents(
            @RequestParam(required = false) String category,
            @RequestParam(defaultValue = "50") int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, limit));
        return ResponseEntity.ok(category != null
                ? eventRepository.findByCategoryOrderByOccurredAtDesc(category, page)
                : eventRepository.findAllByOrderByOccurredAtDesc(page));
    }
}
