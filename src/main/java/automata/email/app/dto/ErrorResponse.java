package automata.email.app.dto;

import automata.email.app.engine.DispatchStep;
import lombok.Value;

@Value
public class ErrorResponse {
    String error;
    DispatchStep failedStep;

    public static ErrorResponse of(String error) {
        return new ErrorResponse(error, null);
    }
}
