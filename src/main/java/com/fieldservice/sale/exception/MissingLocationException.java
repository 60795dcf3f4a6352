package com.fieldservice.sale.exception;

/**
 * Raised when a sale order needs field service but has no service location.
 */
public class MissingLocationException extends NotValidException {

    private static final long serialVersionUID = 1L;

    private final Long saleOrderId;

    public MissingLocationException(Long saleOrderId, String msg) {
        super(msg);
        this.saleOrderId = saleOrderId;
    }

    public Long getSaleOrderId() {
        return saleOrderId;
    }
}
