package com.manna.ledger.controller;

import com.manna.ledger.controller.dto.SubstantiationUpdateRequestDto;
import com.manna.ledger.model.ExpenseSubstantiation;
import com.manna.ledger.model.SubstantiationUpdate;
import com.manna.ledger.security.AuthenticatedUserProvider;
import com.manna.ledger.tax.SubstantiationService;
import jakarta.validation.Valid;
import java.util.UUID;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/tax/business-expense")
public class BusinessExpenseController {

    private final SubstantiationService substantiationService;
    private final AuthenticatedUserProvider authenticatedUserProvider;

    public BusinessExpenseController(SubstantiationService substantiationService,
                                     AuthenticatedUserProvider authenticatedUserProvider) {
        this.substantiationService = substantiationService;
        this.authenticatedUserProvider = authenticatedUserProvider;
    }

    @GetMapping("/{transactionId}")
    public ExpenseSubstantiation getSubstantiation(@PathVariable("transactionId") UUID transactionId) {
        return substantiationService.getSubstantiation(transactionId, authenticatedUserProvider.requireCurrentUserId());
    }

    @PutMapping("/{transactionId}")
    public ExpenseSubstantiation updateSubstantiation(
            @PathVariable("transactionId") UUID transactionId,
            @RequestBody @Valid SubstantiationUpdateRequestDto request
    ) {
        var update = new SubstantiationUpdate(
                request.businessPurpose(),
                request.receiptAttached(),
                request.receiptUrl(),
                request.mileageStartLocation(),
                request.mileageEndLocation(),
                request.milesDriven(),
                request.vehicleInfo(),
                request.depreciationMethod(),
                request.depreciationYears(),
                request.section179Eligible(),
                request.substantiationNotes()
        );
        return substantiationService.updateSubstantiation(transactionId, authenticatedUserProvider.requireCurrentUserId(), update);
    }
}
