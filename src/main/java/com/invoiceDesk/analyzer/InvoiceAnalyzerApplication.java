package com.invoiceDesk.analyzer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class InvoiceAnalyzerApplication {

    public static void main(String[] args) {
        SpringApplication.run(InvoiceAnalyzerApplication.class, args);
    }
}
