package com.tablesmith.cli.fixtures;

import com.tablesmith.core.annotations.ForeignKey;
import com.tablesmith.core.annotations.NotNull;
import com.tablesmith.core.annotations.Precision;
import com.tablesmith.core.annotations.PrimaryKey;
import com.tablesmith.core.annotations.Table;
import com.tablesmith.core.schema.ReferentialAction;

import java.math.BigDecimal;
import java.util.UUID;

@Table(name = "Invoices", schema = "billing")
public class Invoice {
    @PrimaryKey
    private UUID id;

    @NotNull
    @ForeignKey(entity = Customer.class, field = "id", onDelete = ReferentialAction.CASCADE)
    private int customerId;

    @Precision(precision = 12, scale = 2)
    private BigDecimal total;
}
