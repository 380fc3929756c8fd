package com.gentoro.mistadopt.exception;

/** The device inventory is missing, malformed or incomplete. Always fatal for the run. */
public class InventoryException extends ProvisionerException {
  public InventoryException(String message) {
    super(ProvisionerErrorCode.INVENTORY_ERROR, message);
  }

  public InventoryException(String message, Throwable cause) {
    super(ProvisionerErrorCode.INVENTORY_ERROR, message, cause);
  }
}
