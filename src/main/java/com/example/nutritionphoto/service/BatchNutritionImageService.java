package com.example.nutritionphoto.service;

import com.example.nutritionphoto.model.NutritionInsight;
import com.example.nutritionphoto.model.ProductContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Evaluates many products concurrently, one task per product. Results keep the order of the
 * input; a product whose evaluation fails yields no insight and does not affect the others.
 */
@Service
public class BatchNutritionImageService {

    private static final Logger log = LoggerFactory.getLogger(BatchNutritionImageService.class);

    private final NutritionImageService nutritionImageService;
    private final Executor executor;

    public BatchNutritionImageService(NutritionImageService nutritionImageService,
                                      @Qualifier("nutritionPhotoExecutor") Executor executor) {
        this.nutritionImageService = nutritionImageService;
        this.executor = executor;
    }

    public List<Optional<NutritionInsight>> evaluateAll(List<ProductContext> products) {
        if (products == null || products.isEmpty()) {
            return List.of();
        }

        List<CompletableFuture<Optional<NutritionInsight>>> futures = new ArrayList<>(products.size());
        for (ProductContext product : products) {
            futures.add(submit(product));
        }

        List<Optional<NutritionInsight>> results = new ArrayList<>(futures.size());
        for (CompletableFuture<Optional<NutritionInsight>> future : futures) {
            results.add(future.join());
        }
        long selected = results.stream().filter(Optional::isPresent).count();
        log.info("Evaluated {} products, {} nutrition photos selected", products.size(), selected);
        return results;
    }

    private CompletableFuture<Optional<NutritionInsight>> submit(ProductContext product) {
        CompletableFuture<Optional<NutritionInsight>> future;
        try {
            future = CompletableFuture.supplyAsync(() -> nutritionImageService.evaluate(product), executor);
        } catch (RejectedExecutionException ex) {
            log.debug("Executor rejected product {}, evaluating on the calling thread", productCode(product));
            try {
                future = CompletableFuture.completedFuture(nutritionImageService.evaluate(product));
            } catch (RuntimeException evaluationFailure) {
                future = CompletableFuture.failedFuture(evaluationFailure);
            }
        }
        return future.exceptionally(ex -> {
            log.error("Nutrition photo evaluation failed for product {}", productCode(product), unwrap(ex));
            return Optional.empty();
        });
    }

    private static String productCode(ProductContext product) {
        return product == null ? null : product.productCode();
    }

    private static Throwable unwrap(Throwable ex) {
        return ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
    }
}
