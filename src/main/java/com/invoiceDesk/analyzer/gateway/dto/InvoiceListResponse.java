package com.invoiceDesk.analyzer.gateway.dto;

import com.invoiceDesk.analyzer.dataset.model.InvoiceRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class InvoiceListResponse {
    
    private List<InvoiceRecord> records;
    private int count;
}
