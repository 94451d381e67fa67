package com.manna.ledger.controller;

import com.manna.ledger.controller.dto.TaxCategoryCreateRequestDto;
import com.manna.ledger.model.NewTaxCategory;
import com.manna.ledger.model.TaxCategory;
import com.manna.ledger.tax.TaxCategoryService;
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
@RequestMapping("/tax/categories")
public class TaxCategoriesController {

    private final TaxCategoryService taxCategoryService;

    public TaxCategoriesController(TaxCategoryService taxCategoryService) {
        this.taxCategoryService = taxCategoryService;
    }

    @GetMapping
    public List<TaxCategory> listCategories(
            @RequestParam(value = "effectiveOnly", required = false, defaultValue = "true") boolean effectiveOnly,
            @RequestParam(value = "taxForm", required = false) String taxForm
    ) {
        return taxCategoryService.listCategories(effectiveOnly, taxForm);
    }

    @PostMapping
    public ResponseEntity<TaxCategory> createCategory(@RequestBody @Valid TaxCategoryCreateRequestDto request) {
        var created = taxCategoryService.createCategory(new NewTaxCategory(
                request.code(),
                request.name(),
                request.taxForm(),
                request.taxLine(),
                request.description(),
                request.deductionType(),
                request.percentageLimit(),
                request.dollarLimit(),
                Boolean.TRUE.equals(request.documentationRequired()),
                request.effectiveDate(),
                request.expirationDate(),
                request.irsReference(),
                request.keywords(),
                request.exclusions(),
                request.specialRules()
        ));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @DeleteMapping("/{categoryId}")
    public TaxCategory deactivateCategory(@PathVariable("categoryId") UUID categoryId) {
        return taxCategoryService.deactivateCategory(categoryId);
    }
}
