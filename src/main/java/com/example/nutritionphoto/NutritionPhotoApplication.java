package com.example.nutritionphoto;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class NutritionPhotoApplication {

    public static void main(String[] args) {
        SpringApplication.run(NutritionPhotoApplication.class, args);
    }
}
