package com.prismTax.simulator.action;

import com.prismTax.simulator.collaborator.exception.CollaboratorCallException;
import com.prismTax.simulator.emitter.service.ResponseEmitter;
import com.prismTax.simulator.gateway.model.TurnContext;
import com.prismTax.simulator.project.model.ActiveProject;
import com.prismTax.simulator.project.model.ProjectCompletion;
import com.prismTax.simulator.project.model.ProjectExpense;
import com.prismTax.simulator.project.service.ProjectFundService;
import com.prismTax.simulator.session.model.SimulatorSession;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import static com.prismTax.simulator.util.NairaFormatter.format;

/**
 * Chat replies for the project fund commands.
 */
@Service
@RequiredArgsConstructor
public class ProjectActions {

    private static final String NO_PROJECT =
            "📁 You have no active project.\n\nStart one with *new project <name> <amount> from <source>*, "
                    + "e.g. *new project Uncle Building 5000000 from Uncle Chukwu*.";

    private final ProjectFundService projectFundService;
    private final ResponseEmitter responseEmitter;

    public void newProject(TurnContext turn, String name, long budget, String source) {
        SimulatorSession session = turn.getSession();
        if (session.getActiveProject() != null) {
            responseEmitter.text(turn, "📁 *" + session.getActiveProject().getName() + "* is still active.\n\n"
                    + "Type *complete project* before starting a new one.");
            return;
        }
        if (budget <= 0) {
            responseEmitter.text(turn, "❌ The project amount must be greater than zero.");
            return;
        }

        responseEmitter.processing(turn, "📁 Setting up your project...");
        ActiveProject project;
        try {
            project = projectFundService.open(session, name, budget, source, turn.getCorrelationId());
        } catch (CollaboratorCallException e) {
            responseEmitter.failure(turn, e);
            return;
        }

        responseEmitter.text(turn, "✅ *Project created: " + project.getName() + "*\n\n"
                + "Budget: " + format(project.getBudget()) + "\n"
                + "Source: " + project.getSource() + "\n\n"
                + "Project funds received from others are not your income. Record spending with "
                + "*project expense <amount> <description>* and keep the receipts.");
    }

    public void expense(TurnContext turn, long amount, String description) {
        SimulatorSession session = turn.getSession();
        if (session.getActiveProject() == null) {
            responseEmitter.text(turn, NO_PROJECT);
            return;
        }
        if (amount <= 0) {
            responseEmitter.text(turn, "❌ The expense amount must be greater than zero.");
            return;
        }

        responseEmitter.processing(turn, "📁 Recording expense...");
        ProjectExpense expense;
        try {
            expense = projectFundService.recordExpense(session, amount, description, turn.getCorrelationId());
        } catch (CollaboratorCallException e) {
            responseEmitter.failure(turn, e);
            return;
        }

        ActiveProject project = session.getActiveProject();
        StringBuilder text = new StringBuilder("✅ Expense recorded: ").append(format(expense.getAmount()));
        if (description != null) {
            text.append(" (").append(description).append(')');
        }
        text.append("\n\nSpent: ").append(format(project.getSpent())).append(" of ").append(format(project.getBudget()))
                .append("\nBalance: ").append(format(project.getBalance()));
        if (project.getBalance() < 0) {
            text.append("\n\n⚠️ This project is now over budget.");
        }
        for (String advisory : expense.getAdvisories()) {
            text.append("\n\n").append(advisory);
        }
        responseEmitter.text(turn, text.toString());
    }

    public void balance(TurnContext turn) {
        SimulatorSession session = turn.getSession();
        if (session.getActiveProject() == null) {
            responseEmitter.text(turn, NO_PROJECT);
            return;
        }

        responseEmitter.processing(turn, "📁 Fetching project balance...");
        ActiveProject project;
        try {
            project = projectFundService.balance(session, turn.getCorrelationId());
        } catch (CollaboratorCallException e) {
            responseEmitter.failure(turn, e);
            return;
        }

        responseEmitter.text(turn, "📁 *" + project.getName() + "*\n\n"
                + "Budget: " + format(project.getBudget()) + "\n"
                + "Spent: " + format(project.getSpent()) + " (" + project.getExpenses().size() + " expenses)\n"
                + "*Balance: " + format(project.getBalance()) + "*");
    }

    public void complete(TurnContext turn) {
        SimulatorSession session = turn.getSession();
        if (session.getActiveProject() == null) {
            responseEmitter.text(turn, NO_PROJECT);
            return;
        }

        responseEmitter.processing(turn, "📁 Closing your project...");
        ProjectCompletion completion;
        try {
            completion = projectFundService.complete(session, turn.getCorrelationId());
        } catch (CollaboratorCallException e) {
            responseEmitter.failure(turn, e);
            return;
        }

        StringBuilder text = new StringBuilder("🏁 *Project completed: ").append(completion.getProjectName()).append("*\n\n")
                .append("Budget: ").append(format(completion.getBudget())).append('\n')
                .append("Spent: ").append(format(completion.getSpent())).append('\n');
        if (completion.getExcess() > 0) {
            text.append("Unspent excess: ").append(format(completion.getExcess())).append('\n')
                    .append("*Tax on excess: ").append(format(completion.getTax())).append("*\n\n")
                    .append("Unspent project funds you keep are treated as your income.");
        } else if (completion.getExcess() < 0) {
            text.append("Over budget by: ").append(format(-completion.getExcess())).append("\n\n")
                    .append("No tax is due on the project funds.");
        } else {
            text.append("\nAll funds were spent. No tax is due on the project funds.");
        }
        responseEmitter.text(turn, text.toString());
    }
}
