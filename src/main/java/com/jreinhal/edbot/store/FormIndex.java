package com.jreinhal.edbot.store;

import com.jreinhal.edbot.model.DocumentRef;
import java.util.List;

/**
 * Exact keyword-to-document mapping used for form requests.
 */
public interface FormIndex {

    List<DocumentRef> resolve(List<String> keywords);
}
