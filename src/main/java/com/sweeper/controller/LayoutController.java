package com.sweeper.controller;

import com.sweeper.dto.LayoutValidationDTO;
import com.sweeper.model.ValidationResult;
import com.sweeper.service.BoardValidator;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Checks test-mode layouts without starting a game.
 */
@RestController
@RequestMapping("/api/layouts")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class LayoutController {

    private final BoardValidator boardValidator;

    /**
     * Validate an 8x8 comma-separated text table. Always 200; the body says whether it passed.
     */
    @PostMapping(value = "/validate", consumes = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<LayoutValidationDTO> validate(@RequestBody String layout) {
        ValidationResult result = boardValidator.validate(layout);
        return ResponseEntity.ok(LayoutValidationDTO.fromResult(result));
    }
}
