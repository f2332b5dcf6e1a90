package com.odata.writer.format;

import com.odata.writer.request.WriterSettings;

import lombok.experimental.UtilityClass;

@UtilityClass
public class PayloadSerializers {

    public PayloadSerializer create(WriterSettings settings) {
        switch (settings.getPayloadFormat()) {
            case ATOM:
                return new AtomPayloadSerializer(settings.getUrlBase());
            case JSON:
            default:
                return new JsonPayloadSerializer(settings.getUrlBase(), settings.isIndent());
        }
    }
}
