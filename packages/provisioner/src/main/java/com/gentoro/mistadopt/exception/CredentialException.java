package com.gentoro.mistadopt.exception;

/** No Mist API key could be resolved. Always fatal for the run. */
public class CredentialException extends ProvisionerException {
  public CredentialException(String message) {
    super(ProvisionerErrorCode.CREDENTIAL_ERROR, message);
  }
}
