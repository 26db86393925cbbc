package dev.cvevaluator.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@Embeddable
@NoArgsConstructor
@AllArgsConstructor
public class EvaluationError {

    @Column(name = "error_code", length = 64)
    private String code;

    @Column(name = "error_message", length = 2000)
    private String message;

    @Column(name = "error_stage", length = 40)
    private String stage;

    @Column(name = "error_timestamp")
    private LocalDateTime timestamp;
}
