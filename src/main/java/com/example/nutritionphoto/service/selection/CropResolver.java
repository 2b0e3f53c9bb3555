package com.example.nutritionphoto.service.selection;

import com.example.nutritionphoto.config.NutritionPhotoProperties;
import com.example.nutritionphoto.model.BoundingBox;
import com.example.nutritionphoto.model.ImageRecord;
import com.example.nutritionphoto.model.ObjectDetection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Picks the nutrition table crop of a selected image. A crop is only attached when the detector
 * reported exactly one confident nutrition table; several confident tables or none leave the
 * insight uncropped.
 */
@Component
public class CropResolver {

    private static final Logger log = LoggerFactory.getLogger(CropResolver.class);

    private final NutritionPhotoProperties.Crop crop;

    public CropResolver(NutritionPhotoProperties properties) {
        this.crop = properties.crop();
    }

    public Optional<BoundingBox> resolve(ImageRecord image) {
        List<ObjectDetection> confident = image.detections().stream()
                .filter(this::isUsable)
                .filter(detection -> crop.label().equals(detection.label()))
                .filter(detection -> detection.confidence() >= crop.minConfidence())
                .collect(Collectors.toList());

        if (confident.size() != 1) {
            log.debug("Image {} has {} confident {} detections, no crop attached",
                    image.imageId(), confident.size(), crop.label());
            return Optional.empty();
        }
        return Optional.of(confident.get(0).boundingBox());
    }

    private boolean isUsable(ObjectDetection detection) {
        if (detection == null || !detection.isWellFormed()) {
            log.debug("Skipping malformed detection {}", detection);
            return false;
        }
        return true;
    }
}
