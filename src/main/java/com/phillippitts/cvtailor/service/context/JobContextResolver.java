package com.phillippitts.cvtailor.service.context;

import com.phillippitts.cvtailor.domain.JobContext;
import com.phillippitts.cvtailor.exception.InputInvalidException;
import com.phillippitts.cvtailor.exception.UpstreamFetchException;
import com.phillippitts.cvtailor.service.backend.GenerationBackend;
import com.phillippitts.cvtailor.service.backend.GenerationPrompt;
import com.phillippitts.cvtailor.service.backend.PromptKind;
import com.phillippitts.cvtailor.service.link.InputClassifier;
import com.phillippitts.cvtailor.service.link.LinkResolver;
import com.phillippitts.cvtailor.service.progress.ProgressReporter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw job input (pasted text or a link) into a {@link JobContext}.
 *
 * <p>Links are fetched and reduced to the posting text by the backend. Company, title and contact
 * addresses come from a JSON extraction call; unparseable output falls back to placeholders
 * rather than failing the request. Addresses found verbatim in the description are merged in.
 */
@Component
public class JobContextResolver {

    private static final Logger LOG = LogManager.getLogger(JobContextResolver.class);
    private static final Pattern EMAIL = Pattern.compile("[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}");

    private final LinkResolver linkResolver;
    private final GenerationBackend backend;

    public JobContextResolver(LinkResolver linkResolver, GenerationBackend backend) {
        this.linkResolver = Objects.requireNonNull(linkResolver, "linkResolver must not be null");
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
    }

    /**
     * @throws InputInvalidException  for blank input
     * @throws UpstreamFetchException if a link cannot be fetched
     */
    public JobContext resolve(String rawInput, ProgressReporter progress) {
        if (rawInput == null || rawInput.isBlank()) {
            throw new InputInvalidException("job description or link is required");
        }
        String input = rawInput.trim();
        String sourceUrl = null;
        String description = input;

        if (InputClassifier.isUrl(input)) {
            sourceUrl = input;
            progress.info("Fetching job posting from link...");
            String pageText = linkResolver.fetchText(input);
            progress.info("Extracting job description from page...");
            description = backend.generate(GenerationPrompt.of(PromptKind.EXTRACT_JOB_DESCRIPTION)
                    .with("pageText", pageText)).trim();
            progress.success("✓ Job description extracted");
        }

        progress.info("Extracting company and job details...");
        String raw = backend.generate(GenerationPrompt.of(PromptKind.EXTRACT_JOB_DETAILS)
                .with("jobDescription", description));
        JobContext context = parseDetails(raw, description, sourceUrl);
        progress.success("✓ " + context.jobTitle() + " at " + context.companyName());
        if (!context.emailAddresses().isEmpty()) {
            progress.info("Found contact email(s): " + String.join(", ", context.emailAddresses()));
        }
        return context;
    }

    static JobContext parseDetails(String raw, String description, String sourceUrl) {
        String company = null;
        String title = null;
        Set<String> emails = new LinkedHashSet<>();
        try {
            JSONObject json = new JSONObject(stripFence(raw));
            company = json.optString("companyName", null);
            title = json.optString("jobTitle", null);
            JSONArray addresses = json.optJSONArray("emailAddresses");
            if (addresses != null) {
                for (int i = 0; i < addresses.length(); i++) {
                    String candidate = addresses.optString(i, "").trim();
                    if (EMAIL.matcher(candidate).matches()) {
                        emails.add(candidate.toLowerCase());
                    }
                }
            }
        } catch (JSONException e) {
            LOG.warn("Job details response was not JSON; using placeholders ({})", e.getMessage());
        }
        Matcher matcher = EMAIL.matcher(description);
        while (matcher.find()) {
            emails.add(matcher.group().toLowerCase());
        }
        return new JobContext(description, company, title, new ArrayList<>(emails), sourceUrl);
    }

    private static String stripFence(String raw) {
        if (raw == null) {
            return "";
        }
        String trimmed = raw.trim();
        int open = trimmed.indexOf('{');
        int close = trimmed.lastIndexOf('}');
        return open >= 0 && close > open ? trimmed.substring(open, close + 1) : trimmed;
    }
}
