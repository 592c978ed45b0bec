package com.flagship.split_ledger.expense;

import com.flagship.split_ledger.expense.dto.CreateExpenseRequest;
import com.flagship.split_ledger.expense.dto.ExpenseResponse;
import com.flagship.split_ledger.group.Member;
import com.flagship.split_ledger.money.Money;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/groups/{groupId}/expenses")
@RequiredArgsConstructor
public class ExpenseController {

    private final ExpenseService expenseService;

    @PostMapping
    public ResponseEntity<ExpenseResponse> addExpense(@PathVariable("groupId") long groupId,
                                                      @Valid @RequestBody CreateExpenseRequest request) {
        Expense expense = expenseService.addExpense(
            groupId,
            Member.of(request.getPayer()),
            Money.parseUnits(request.getAmount()),
            request.getDescription(),
            request.getParticipants().stream().map(Member::of).toList()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(ExpenseResponse.from(expense));
    }

    @GetMapping
    public List<ExpenseResponse> listExpenses(@PathVariable("groupId") long groupId) {
        return expenseService.listExpenses(groupId).stream()
            .map(ExpenseResponse::from)
            .toList();
    }
}
