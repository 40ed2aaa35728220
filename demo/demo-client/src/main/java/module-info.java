/**
 * Demo client module.
 *
 * <p>Pairs with a running vault and issues requests from the command line.</p>
 */
module demo.client
{
    requires vaultbridge.api;
    requires vaultbridge.impl;
    requires com.fasterxml.jackson.databind;
    requires org.slf4j;
}
