package com.pervasivecode.utils.boundedqueue.cucumber;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.truth.Truth.assertThat;
import java.io.PrintWriter;
import java.io.StringWriter;
import com.pervasivecode.utils.boundedqueue.example.ExampleApplication;
import com.pervasivecode.utils.boundedqueue.example.NumberTransferExample;
import com.pervasivecode.utils.boundedqueue.example.TwoProducerTransferExample;
import cucumber.api.java.en.Given;
import cucumber.api.java.en.Then;
import cucumber.api.java.en.When;

public class StepDefinitions {
  private String commandOutput = "";
  private ExampleApplication codeExample = null;

  @Given("^I am running the Number Transfer Example$")
  public void iAmRunningTheNumberTransferExample() {
    this.codeExample = new NumberTransferExample();
    this.commandOutput = "";
  }

  @Given("^I am running the Two Producer Transfer Example$")
  public void iAmRunningTheTwoProducerTransferExample() {
    this.codeExample = new TwoProducerTransferExample();
    this.commandOutput = "";
  }

  @When("^I run the program$")
  public void iRunTheProgram() throws Exception {
    checkNotNull(this.codeExample, "did you forget an 'I am running the' example step?");
    StringWriter sw = new StringWriter();
    this.codeExample.runExample(new PrintWriter(sw, true));
    commandOutput = commandOutput.concat(sw.toString());
  }

  @Then("^I should see the output$")
  public void iShouldSeeTheOutput(String expected) {
    assertThat(this.commandOutput.trim()).isEqualTo(expected.trim());
  }
}
