package com.invoiceDesk.analyzer.heuristic.model;

import com.invoiceDesk.analyzer.dataset.model.InvoiceRecord;
import com.invoiceDesk.analyzer.dataset.model.RecordSet;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Aggregates derived once per request from a {@link RecordSet}.
 */
@Getter
public final class InvoiceAggregates {
    
    static final String STATUS_PAID = "paid";
    static final String STATUS_PARTIALLY_PAID = "partially paid";
    
    private static final Pattern NON_NEGATIVE_NUMERAL = Pattern.compile("\\d+(\\.\\d*)?|\\.\\d+");
    
    private final int total;
    private final BigDecimal sumAmount;
    private final int paidCount;
    private final int partialCount;
    private final Set<String> uniqueCustomers;
    
    /**
     * Summed amount per customer, keyed in first-occurrence order.
     */
    private final Map<String, BigDecimal> amountByCustomer;
    
    private InvoiceAggregates(int total, BigDecimal sumAmount, int paidCount, int partialCount,
                              Set<String> uniqueCustomers, Map<String, BigDecimal> amountByCustomer) {
        this.total = total;
        this.sumAmount = sumAmount;
        this.paidCount = paidCount;
        this.partialCount = partialCount;
        this.uniqueCustomers = Collections.unmodifiableSet(uniqueCustomers);
        this.amountByCustomer = Collections.unmodifiableMap(amountByCustomer);
    }
    
    public static InvoiceAggregates of(RecordSet records) {
        BigDecimal sum = BigDecimal.ZERO;
        int paid = 0;
        int partial = 0;
        Set<String> customers = new LinkedHashSet<>();
        Map<String, BigDecimal> byCustomer = new LinkedHashMap<>();
        
        for (InvoiceRecord record : records.getRecords()) {
            BigDecimal amount = parseAmount(record.getAmount());
            sum = sum.add(amount);
            customers.add(record.getCustomer());
            byCustomer.merge(record.getCustomer(), amount, BigDecimal::add);
            
            String status = record.getStatus() == null ? "" : record.getStatus().toLowerCase(Locale.ROOT);
            if (STATUS_PAID.equals(status)) {
                paid++;
            } else if (STATUS_PARTIALLY_PAID.equals(status)) {
                partial++;
            }
        }
        
        return new InvoiceAggregates(records.size(), sum, paid, partial, customers, byCustomer);
    }
    
    /**
     * Parses a well-formed non-negative numeral; anything else counts as zero.
     */
    static BigDecimal parseAmount(String amount) {
        if (amount == null || !NON_NEGATIVE_NUMERAL.matcher(amount).matches()) {
            return BigDecimal.ZERO;
        }
        return new BigDecimal(amount.endsWith(".") ? amount.substring(0, amount.length() - 1) : amount);
    }
}
