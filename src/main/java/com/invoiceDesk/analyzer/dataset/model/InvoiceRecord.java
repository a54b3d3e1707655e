package com.invoiceDesk.analyzer.dataset.model;

import lombok.Builder;
import lombok.Value;

/**
 * One invoice row as it appeared in the dataset.
 * 
 * All fields are kept as the literal strings that were read. The amount may be malformed
 * and paidAt is never interpreted as a date.
 */
@Value
@Builder
public class InvoiceRecord {
    
    String id;
    
    String customer;
    
    /**
     * Decimal amount as written in the dataset (e.g. "1250.00"). May be empty or malformed.
     */
    String amount;
    
    String paidAt;
    
    /**
     * Free-text status such as "Paid" or "Partially Paid". Compared case-insensitively.
     */
    String status;
}
