package ai.pipestream.staging.http;

import ai.pipestream.staging.exception.InvalidRequestException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.xml.ser.ToXmlGenerator;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.util.List;

/**
 * Reads and writes legacy staging documents as XML or JSON.
 * <p>
 * Responses follow {@code Accept}, then {@code Content-Type}, then default to XML.
 * Request bodies follow {@code Content-Type} and default to XML.
 */
@ApplicationScoped
public class LegacyDocumentCodec {

    private static final Logger LOG = Logger.getLogger(LegacyDocumentCodec.class);

    enum Format {
        XML(MediaType.APPLICATION_XML),
        JSON(MediaType.APPLICATION_JSON);

        final String mediaType;

        Format(String mediaType) {
            this.mediaType = mediaType;
        }
    }

    /**
     * The application's Jackson mapper, as configured by Quarkus.
     */
    @Inject
    ObjectMapper json;

    private final XmlMapper xml = (XmlMapper) new XmlMapper()
            .configure(ToXmlGenerator.Feature.WRITE_XML_DECLARATION, true)
            .configure(SerializationFeature.INDENT_OUTPUT, true)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public LegacyDocumentCodec() {
    }

    LegacyDocumentCodec(ObjectMapper json) {
        this.json = json;
    }

    public Response respond(HttpHeaders headers, Object document) {
        return respond(headers, Response.Status.OK, document);
    }

    public Response respond(HttpHeaders headers, Response.Status status, Object document) {
        Format format = responseFormat(headers.getAcceptableMediaTypes(), headers.getMediaType());
        return Response.status(status)
                .type(format.mediaType)
                .entity(write(format, document))
                .build();
    }

    String write(Format format, Object document) {
        try {
            return format == Format.JSON ? json.writeValueAsString(document) : xml.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize " + document.getClass().getSimpleName(), e);
        }
    }

    public <T> T read(HttpHeaders headers, byte[] body, Class<T> type) {
        return read(headers.getMediaType(), body, type);
    }

    <T> T read(MediaType contentType, byte[] body, Class<T> type) {
        Format format = format(contentType);
        if (format == null) {
            format = Format.XML;
        }
        if (body == null || body.length == 0) {
            throw new InvalidRequestException("read", "Missing " + type.getSimpleName() + " body");
        }
        try {
            T value = format == Format.JSON ? json.readValue(body, type) : xml.readValue(body, type);
            LOG.tracef("Read %s as %s", type.getSimpleName(), format);
            return value;
        } catch (JsonProcessingException e) {
            throw new InvalidRequestException("read", "Unable to parse " + type.getSimpleName() + ": "
                    + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new InvalidRequestException("read", "Unable to read " + type.getSimpleName() + ": "
                    + e.getMessage(), e);
        }
    }

    static Format responseFormat(List<MediaType> accept, MediaType contentType) {
        if (accept != null) {
            for (MediaType mediaType : accept) {
                Format format = format(mediaType);
                if (format != null) {
                    return format;
                }
            }
        }
        Format format = format(contentType);
        return format == null ? Format.XML : format;
    }

    static Format format(MediaType mediaType) {
        if (mediaType == null || !"application".equalsIgnoreCase(mediaType.getType())) {
            return null;
        }
        String subtype = mediaType.getSubtype().toLowerCase();
        if (subtype.equals("xml") || subtype.endsWith("+xml")) {
            return Format.XML;
        }
        if (subtype.equals("json") || subtype.endsWith("+json")) {
            return Format.JSON;
        }
        return null;
    }
}
