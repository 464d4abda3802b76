package com.jordtransport.manifest.dto;

import com.jordtransport.manifest.exception.FatalErrorCode;
import lombok.Value;

@Value
public class FatalError {
    FatalErrorCode code;
    String message;
}
