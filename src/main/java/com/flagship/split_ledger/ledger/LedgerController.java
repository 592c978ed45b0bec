package com.flagship.split_ledger.ledger;

import com.flagship.split_ledger.group.Member;
import com.flagship.split_ledger.ledger.dto.BalancesResponse;
import com.flagship.split_ledger.ledger.dto.DebtResponse;
import com.flagship.split_ledger.ledger.dto.RoundingRemainderResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/groups/{groupId}")
@RequiredArgsConstructor
public class LedgerController {

    private final BalanceQueryService balanceQueryService;

    @GetMapping("/balances")
    public BalancesResponse getBalances(@PathVariable("groupId") long groupId) {
        return BalancesResponse.from(balanceQueryService.getBalances(groupId));
    }

    @GetMapping("/debts")
    public List<DebtResponse> getSimplifiedDebts(@PathVariable("groupId") long groupId,
                                                 @RequestParam(name = "member", required = false) String member) {
        List<SimplifiedDebt> debts = member == null
            ? balanceQueryService.getSimplifiedDebts(groupId)
            : balanceQueryService.getSimplifiedDebts(groupId, Member.of(member));
        return debts.stream().map(DebtResponse::from).toList();
    }

    @GetMapping("/rounding")
    public List<RoundingRemainderResponse> getRoundingRemainders(@PathVariable("groupId") long groupId) {
        return balanceQueryService.getRoundingRemainders(groupId).stream()
            .map(RoundingRemainderResponse::from)
            .toList();
    }
}
