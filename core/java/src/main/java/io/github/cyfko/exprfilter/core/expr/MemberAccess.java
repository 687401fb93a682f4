package io.github.cyfko.exprfilter.core.expr;

import java.util.Objects;

/**
 * Navigation from {@code target} to one of its properties.
 * <p>
 * Chains of member accesses express nested navigation, e.g.
 * {@code x.customer.firstName} is {@code MemberAccess(MemberAccess(x, "customer"), "firstName")}.
 * </p>
 *
 * @param target the expression whose value owns the member
 * @param member the property name
 * @author Frank KOSSI
 * @since 1.0
 */
public record MemberAccess(Expr target, String member) implements Expr {

    public MemberAccess {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(member, "member must not be null");
        if (member.isBlank()) {
            throw new IllegalArgumentException("member name must not be blank");
        }
    }

    @Override
    public <R> R accept(ExprVisitor<R> visitor) {
        return visitor.visitMemberAccess(this);
    }

    @Override
    public String toString() {
        return ExprPrinter.print(this);
    }
}
