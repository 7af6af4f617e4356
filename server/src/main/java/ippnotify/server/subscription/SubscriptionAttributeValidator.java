package ippnotify.server.subscription;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ippnotify.api.model.AttributeGroup;
import ippnotify.api.model.EventKind;
import ippnotify.api.model.IppAttribute;
import ippnotify.api.model.IppStatus;
import ippnotify.api.model.ValueTag;

/**
 * Checks the attributes of one subscription group. Every attribute is examined so that all offending ones are reported together.
 */
public class SubscriptionAttributeValidator {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionAttributeValidator.class);

    public static final String PULL_METHOD = "ippget";
    public static final int MAX_USER_DATA = 63;

    private final int defaultLeaseSeconds;

    public SubscriptionAttributeValidator(int defaultLeaseSeconds) {
        this.defaultLeaseSeconds = defaultLeaseSeconds;
    }

    public ValidationResult validate(AttributeGroup group) {
        IppStatus status = IppStatus.SUCCESSFUL_OK;
        List<IppAttribute> unsupported = new ArrayList<>();
        String pullMethod = null;
        String language = "en";
        Set<EventKind> events = EnumSet.noneOf(EventKind.class);
        byte[] userData = null;
        int lease = defaultLeaseSeconds;
        int interval = 0;

        for (IppAttribute attr : group.getAttributes()) {
            boolean bad = false;
            switch (attr.getName()) {
                case "notify-recipient-uri":
                    // push delivery is not offered
                    bad = true;
                    break;
                case "notify-pull-method":
                    if (isSingle(attr, ValueTag.KEYWORD) && PULL_METHOD.equals(attr.getString(0))) {
                        pullMethod = attr.getString(0);
                    } else {
                        bad = true;
                    }
                    break;
                case "notify-charset":
                    String charset = attr.getString(0);
                    bad = !isSingle(attr, ValueTag.CHARSET) || !("us-ascii".equals(charset) || "utf-8".equals(charset));
                    break;
                case "notify-natural-language":
                    if (isSingle(attr, ValueTag.NATURAL_LANGUAGE) && attr.getString(0) != null) {
                        language = attr.getString(0);
                    } else {
                        bad = true;
                    }
                    break;
                case "notify-user-data":
                    byte[] data = isSingle(attr, ValueTag.OCTET_STRING) ? decode(attr) : null;
                    if (data == null || data.length > MAX_USER_DATA) {
                        bad = true;
                    } else {
                        userData = data;
                    }
                    break;
                case "notify-events":
                    if (attr.getValueTag() == ValueTag.KEYWORD) {
                        events = EventKind.fromKeywords(attr.getStrings());
                    } else {
                        bad = true;
                    }
                    break;
                case "notify-lease-duration":
                    Integer l = isSingle(attr, ValueTag.INTEGER) ? attr.getInteger(0) : null;
                    if (l == null || l < 0) {
                        bad = true;
                    } else {
                        lease = l;
                    }
                    break;
                case "notify-time-interval":
                    Integer i = isSingle(attr, ValueTag.INTEGER) ? attr.getInteger(0) : null;
                    if (i == null || i < 0) {
                        bad = true;
                    } else {
                        interval = i;
                    }
                    break;
                default:
                    break;
            }
            if (bad) {
                log.debug("Unsupported subscription attribute {}", attr);
                status = IppStatus.CLIENT_ERROR_ATTRIBUTES_OR_VALUES_NOT_SUPPORTED;
                unsupported.add(attr.copy());
            }
        }

        if (pullMethod == null || events.isEmpty()) {
            status = IppStatus.CLIENT_ERROR_BAD_REQUEST;
        }
        if (status != IppStatus.SUCCESSFUL_OK) {
            return ValidationResult.failed(status, unsupported);
        }
        return ValidationResult.ok(new SubscriptionTemplate(events, language, userData, lease, interval), unsupported);
    }

    private static boolean isSingle(IppAttribute attr, ValueTag tag) {
        return attr.getValueTag() == tag && attr.getCount() == 1;
    }

    private static byte[] decode(IppAttribute attr) {
        try {
            return attr.getOctetString(0);
        } catch (IllegalArgumentException e) {
            log.debug("notify-user-data is not base64: {}", e.getMessage());
            return null;
        }
    }
}
