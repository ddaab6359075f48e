package com.phillippitts.cvtailor.service.backend;

/**
 * Prompt templates. Placeholders use {@code {name}} and are filled from
 * {@link GenerationPrompt#variables()}.
 */
public enum PromptKind {

    EXTRACT_JOB_DESCRIPTION(
            "Extract the job posting from the following web page text. "
                    + "Return only the job description as plain text.\n\n{pageText}"),

    EXTRACT_JOB_DETAILS(
            "From the job description below, return a JSON object with the keys \"companyName\", "
                    + "\"jobTitle\" and \"emailAddresses\" (array of contact email addresses, possibly empty). "
                    + "Return only JSON.\n\nJob description:\n{jobDescription}"),

    GENERATE_CV(
            "Tailor the LaTeX CV below to the job posting. The compiled CV must be exactly "
                    + "{targetPageCount} pages.\n\nCV strategy:\n{cvStrategy}\n\n"
                    + "Job description:\n{jobDescription}\n\nOriginal CV (LaTeX):\n{originalCv}\n\n"
                    + "Extensive CV:\n{extensiveCv}\n\nReturn only the complete LaTeX document."),

    FIX_PAGE_COUNT(
            "The previous version compiled to {previousPageCount} pages, need {targetPageCount}. "
                    + "Adjust the length without losing the content most relevant to the job below. "
                    + "Return only the complete LaTeX document.\n\n"
                    + "Job description:\n{jobDescription}\n\nPrevious version:\n{previousContent}"),

    FIX_COMPILE_ERROR(
            "The previous LaTeX document failed to compile with these errors:\n{diagnostic}\n\n"
                    + "Fix the errors and keep the document at {targetPageCount} pages. "
                    + "Return only the complete LaTeX document.\n\nPrevious version:\n{previousContent}"),

    CV_CHANGE_SUMMARY(
            "Summarise in a few bullet points how the tailored CV differs from the original "
                    + "and why the changes fit the job.\n\nOriginal CV:\n{originalCv}\n\n"
                    + "Tailored CV:\n{tailoredCv}\n\nJob description:\n{jobDescription}"),

    COVER_LETTER(
            "Write a cover letter for the {jobTitle} position at {companyName}.\n\n"
                    + "Cover letter strategy:\n{coverLetterStrategy}\n\n"
                    + "Job description:\n{jobDescription}\n\nTailored CV:\n{cvText}"),

    COLD_EMAIL(
            "Write a short cold email for the {jobTitle} position at {companyName}. "
                    + "Known contact addresses: {emailAddresses}.\n\n"
                    + "Cold email strategy:\n{coldEmailStrategy}\n\n"
                    + "Job description:\n{jobDescription}\n\nTailored CV:\n{cvText}"),

    REFINE(
            "Revise the {documentType} below according to the feedback. "
                    + "Return only the revised document.\n\nFeedback:\n{feedback}\n\n"
                    + "Current version:\n{currentContent}\n\nJob description:\n{jobDescription}");

    private final String template;

    PromptKind(String template) {
        this.template = template;
    }

    public String template() {
        return template;
    }
}
