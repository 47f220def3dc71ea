package com.flagship.interunit_recon.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.interunit_recon.transaction.TransactionRecord;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Locale;

@Value
@Builder
public class UnmatchedLegResponse {

    @JsonProperty("uid")
    String uid;

    @JsonProperty("role")
    String role;

    @JsonProperty("lender_company")
    String lenderCompany;

    @JsonProperty("borrower_company")
    String borrowerCompany;

    @JsonProperty("statement_month")
    String statementMonth;

    @JsonProperty("statement_year")
    String statementYear;

    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("particulars")
    String particulars;

    @JsonProperty("voucher_type")
    String voucherType;

    @JsonProperty("voucher_no")
    String voucherNo;

    @JsonProperty("debit")
    BigDecimal debit;

    @JsonProperty("credit")
    BigDecimal credit;

    @JsonProperty("entered_by")
    String enteredBy;

    @JsonProperty("pair_id")
    String pairId;

    public static UnmatchedLegResponse from(TransactionRecord record) {
        return UnmatchedLegResponse.builder()
            .uid(record.getUid())
            .role(record.getRole().name().toLowerCase(Locale.ROOT))
            .lenderCompany(record.getLenderCompany())
            .borrowerCompany(record.getBorrowerCompany())
            .statementMonth(record.getStatementMonth())
            .statementYear(record.getStatementYear())
            .date(record.getTxnDate())
            .particulars(record.getParticulars())
            .voucherType(record.getVoucherType())
            .voucherNo(record.getVoucherNo())
            .debit(record.getDebit())
            .credit(record.getCredit())
            .enteredBy(record.getEnteredBy())
            .pairId(record.getPairId())
            .build();
    }
}
