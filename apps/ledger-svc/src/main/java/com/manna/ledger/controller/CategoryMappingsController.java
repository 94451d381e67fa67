package com.manna.ledger.controller;

import com.manna.ledger.controller.dto.CategoryMappingCreateRequestDto;
import com.manna.ledger.model.CategoryMapping;
import com.manna.ledger.model.NewCategoryMapping;
import com.manna.ledger.security.AuthenticatedUserProvider;
import com.manna.ledger.tax.CategoryMappingService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/tax/category-mappings")
public class CategoryMappingsController {

    private final CategoryMappingService mappingService;
    private final AuthenticatedUserProvider authenticatedUserProvider;

    public CategoryMappingsController(CategoryMappingService mappingService,
                                      AuthenticatedUserProvider authenticatedUserProvider) {
        this.mappingService = mappingService;
        this.authenticatedUserProvider = authenticatedUserProvider;
    }

    @PostMapping
    public ResponseEntity<CategoryMapping> createMapping(@RequestBody @Valid CategoryMappingCreateRequestDto request) {
        UUID userId = authenticatedUserProvider.requireCurrentUserId();
        var created = mappingService.createMapping(userId, new NewCategoryMapping(
                request.sourceCategoryId(),
                request.chartAccountId(),
                request.taxCategoryId(),
                request.confidenceScore(),
                request.userDefined(),
                request.effectiveDate(),
                request.expirationDate(),
                request.businessPercentageDefault(),
                Boolean.TRUE.equals(request.alwaysRequireReceipt()),
                request.notes()
        ));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping
    public List<CategoryMapping> listMappings(
            @RequestParam(value = "activeOnly", required = false, defaultValue = "true") boolean activeOnly
    ) {
        return mappingService.listMappings(authenticatedUserProvider.requireCurrentUserId(), activeOnly);
    }

    @DeleteMapping("/{mappingId}")
    public CategoryMapping deactivateMapping(@PathVariable("mappingId") UUID mappingId) {
        return mappingService.deactivateMapping(authenticatedUserProvider.requireCurrentUserId(), mappingId);
    }
}
