package uk.gegc.examimport.features.csv.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

@Component
@Data
@Validated
@ConfigurationProperties(prefix = "exam.import.csv")
public class CsvImportProperties {

    /**
     * Minimum number of semicolons the header line needs before semicolon is chosen as delimiter.
     */
    @NotNull(message = "Property exam.import.csv.semicolon-min-count must be configured")
    @Min(value = 1, message = "exam.import.csv.semicolon-min-count must be at least 1")
    private Integer semicolonMinCount = 5;

    @NotNull(message = "Property exam.import.csv.max-file-size must be configured")
    private DataSize maxFileSize = DataSize.ofMegabytes(5);
}
