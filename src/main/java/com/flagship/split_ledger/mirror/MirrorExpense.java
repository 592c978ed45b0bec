package com.flagship.split_ledger.mirror;

import com.flagship.split_ledger.group.Member;
import com.flagship.split_ledger.money.Money;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
public class MirrorExpense {
    long id;
    long groupId;
    Member payer;
    Money amount;
    String description;
    Instant timestamp;
    List<Member> participants;
}
