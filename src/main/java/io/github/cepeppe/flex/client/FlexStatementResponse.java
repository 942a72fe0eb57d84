package io.github.cepeppe.flex.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import io.github.cepeppe.flex.exception.FlexRetrievalException;
import io.github.cepeppe.flex.utils.HttpUtils;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.io.IOException;

/**
 * Busta XML restituita da {@code SendRequest} e, se lo statement non è pronto, da {@code GetStatement}.
 *
 * <pre>{@code
 * <FlexStatementResponse timestamp="...">
 *   <Status>Success</Status>
 *   <ReferenceCode>1234567890</ReferenceCode>
 *   <Url>https://.../FlexStatementService.GetStatement</Url>
 * </FlexStatementResponse>
 * }</pre>
 *
 * In caso di errore {@code Status} vale {@code Fail} (o {@code Warn}) e sono valorizzati
 * {@code ErrorCode} e {@code ErrorMessage}.
 */
@Getter
@Setter
@NoArgsConstructor
@ToString
@JsonIgnoreProperties(ignoreUnknown = true)
public class FlexStatementResponse {

    private static final XmlMapper XML = XmlMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    @JsonProperty("Status")
    private String status;

    @JsonProperty("ReferenceCode")
    private String referenceCode;

    @JsonProperty("Url")
    private String url;

    @JsonProperty("ErrorCode")
    private Integer errorCode;

    @JsonProperty("ErrorMessage")
    private String errorMessage;

    public boolean isSuccess() {
        return "Success".equalsIgnoreCase(status);
    }

    public boolean hasErrorCode() {
        return errorCode != null;
    }

    /**
     * Legge la busta dal body grezzo di una risposta; la codifica è quella del prolog.
     *
     * @throws FlexRetrievalException con codice {@code BAD_RESPONSE} se il body non è una busta valida
     */
    public static FlexStatementResponse fromXml(byte[] body) {
        String preview = HttpUtils.asciiView(body);
        if (preview.isBlank()) {
            throw FlexRetrievalException.badResponse("Empty response from Flex service", null);
        }
        if (!preview.contains("FlexStatementResponse")) {
            throw FlexRetrievalException.badResponse(
                    "Unexpected response from Flex service: " + HttpUtils.safePreview(preview, 200), null);
        }
        try {
            return XML.readValue(body, FlexStatementResponse.class);
        } catch (IOException e) {
            throw FlexRetrievalException.badResponse(
                    "Unparseable FlexStatementResponse: " + HttpUtils.safePreview(preview, 200), e);
        }
    }
}
