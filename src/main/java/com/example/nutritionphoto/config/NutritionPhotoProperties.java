package com.example.nutritionphoto.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "nutrition-photo")
public record NutritionPhotoProperties(
        @Valid @DefaultValue Selection selection,
        @Valid @DefaultValue Crop crop,
        @Valid @DefaultValue Batch batch) {

    public static NutritionPhotoProperties defaults() {
        return new NutritionPhotoProperties(
                new Selection(4, 3, true),
                new Crop("nutrition-table", 0.9),
                new Batch(4, 4, 1000, "nutrition-photo-"));
    }

    /**
     * Evidence an image needs, per language, to qualify as a nutrition table photo.
     */
    public record Selection(
            @Min(1) @DefaultValue("4") int minNameMentions,
            @Min(1) @DefaultValue("3") int minValueMentions,
            @DefaultValue("true") boolean requireEnergyValue) {
    }

    public record Crop(
            @NotBlank @DefaultValue("nutrition-table") String label,
            @DecimalMin("0.0") @DecimalMax("1.0") @DefaultValue("0.9") double minConfidence) {
    }

    public record Batch(
            @Min(1) @DefaultValue("4") int corePoolSize,
            @Min(1) @DefaultValue("4") int maxPoolSize,
            @Min(0) @DefaultValue("1000") int queueCapacity,
            @NotBlank @DefaultValue("nutrition-photo-") String threadNamePrefix) {
    }
}
